package org.javai.restretry.ops;

import org.javai.restretry.Failure;
import org.javai.restretry.FailureId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FailureReporterTest {

	private final Failure failure =
			Failure.transientFailure(FailureId.of("network", "timeout"), "timed out", "RestClient.get", null);

	@Test
	void composite_fansOutToAllReporters() {
		List<Failure> first = new ArrayList<>();
		List<Failure> second = new ArrayList<>();

		FailureReporter.composite(first::add, second::add).report(failure);

		assertThat(first).containsExactly(failure);
		assertThat(second).containsExactly(failure);
	}

	@Test
	void composite_throwingReporter_othersStillRunThenFirstFaultSurfaces() {
		List<Failure> collected = new ArrayList<>();
		IllegalStateException sinkDown = new IllegalStateException("sink down");
		IllegalArgumentException badConfig = new IllegalArgumentException("bad config");

		FailureReporter composite = FailureReporter.composite(
				f -> { throw sinkDown; },
				collected::add,
				f -> { throw badConfig; });

		Throwable thrown = catchThrowable(() -> composite.report(failure));

		assertThat(collected).containsExactly(failure);
		assertThat(thrown).isSameAs(sinkDown);
		assertThat(thrown.getSuppressed()).containsExactly(badConfig);
	}

	@Test
	void composite_copiesCollection() {
		List<Failure> collected = new ArrayList<>();
		List<FailureReporter> reporters = new ArrayList<>();
		reporters.add(collected::add);
		FailureReporter composite = FailureReporter.composite(reporters);

		reporters.add(collected::add);
		composite.report(failure);

		assertThat(collected).hasSize(1);
	}

	@Test
	void composite_rejectsNullReporter() {
		assertThatThrownBy(() -> FailureReporter.composite(FailureReporter.noOp(), null))
				.isInstanceOf(NullPointerException.class);
	}

	@Test
	void noOp_acceptsAnything() {
		assertThatCode(() -> FailureReporter.noOp().report(failure)).doesNotThrowAnyException();
	}
}
