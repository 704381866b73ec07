package org.javai.restretry.ops;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ReporterUtilsTest {

	@Test
	void escapeJson_handlesAllSpecialCharacters() {
		assertThat(ReporterUtils.escapeJson("hello\\world")).isEqualTo("hello\\\\world");
		assertThat(ReporterUtils.escapeJson("hello\"world")).isEqualTo("hello\\\"world");
		assertThat(ReporterUtils.escapeJson("hello\nworld")).isEqualTo("hello\\nworld");
		assertThat(ReporterUtils.escapeJson("hello\rworld")).isEqualTo("hello\\rworld");
		assertThat(ReporterUtils.escapeJson("hello\tworld")).isEqualTo("hello\\tworld");
	}

	@Test
	void escapeJson_escapesEveryControlCharacter() {
		assertThat(ReporterUtils.escapeJson("bad\bvalue\f")).isEqualTo("bad\\bvalue\\f");
		assertThat(ReporterUtils.escapeJson("nul\u0000 soh\u0001 us\u001f")).isEqualTo("nul\\u0000 soh\\u0001 us\\u001f");
		assertThat(ReporterUtils.escapeJson("caf\u00e9 ~")).isEqualTo("caf\u00e9 ~");
	}

	@Test
	void escapeJson_handlesNull() {
		assertThat(ReporterUtils.escapeJson(null)).isEmpty();
	}

	@Test
	void formatTags_sortsByKey() {
		assertThat(ReporterUtils.formatTags(Map.of("url", "/a", "attempts", "3")))
				.isEqualTo("attempts=3, url=/a");
	}

	@Test
	void formatTags_emptyOrNull_isEmpty() {
		assertThat(ReporterUtils.formatTags(Map.of())).isEmpty();
		assertThat(ReporterUtils.formatTags(null)).isEmpty();
	}
}
