package org.javai.restretry.client;

import org.junit.jupiter.api.Test;

import java.net.ConnectException;

import static org.assertj.core.api.Assertions.*;

class TransportExceptionTest {

    @Test
    void forStatus_carriesStatusAndUrl() {
        TransportException e = TransportException.forStatus("/orders/7", 502);

        assertThat(e.statusCode()).isEqualTo(502);
        assertThat(e.hasStatus()).isTrue();
        assertThat(e.url()).isEqualTo("/orders/7");
        assertThat(e).hasMessage("HTTP 502 from /orders/7");
    }

    @Test
    void withoutStatus_reportsNoStatus() {
        ConnectException cause = new ConnectException("refused");
        TransportException e = new TransportException("connect failed", "/orders", cause);

        assertThat(e.hasStatus()).isFalse();
        assertThat(e.statusCode()).isEqualTo(TransportException.NO_STATUS);
        assertThat(e).hasCause(cause);
    }
}
