package dev.jbang.apidiff.util;

import static org.assertj.core.api.Assertions.*;

import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

	@Test
	void testCancel() {
		// Given
		CancellationSignal signal = CancellationSignal.create();

		// When
		signal.cancel();

		// Then
		assertThat(signal.isCancelled()).isTrue();
		assertThatThrownBy(signal::throwIfCancelled).isInstanceOf(CancellationException.class);
	}

	@Test
	void testChildFollowsParent() {
		// Given
		CancellationSignal parent = CancellationSignal.create();
		CancellationSignal child = parent.child();

		// When
		parent.cancel();

		// Then
		assertThat(child.isCancelled()).isTrue();
	}

	@Test
	void testChildCancelDoesNotAffectParent() {
		// Given
		CancellationSignal parent = CancellationSignal.create();
		CancellationSignal child = parent.child();

		// When
		child.cancel();

		// Then
		assertThat(child.isCancelled()).isTrue();
		assertThat(parent.isCancelled()).isFalse();
	}

	@Test
	void testNoneCannotBeCancelled() {
		// Given
		CancellationSignal none = CancellationSignal.none();

		// When/Then
		assertThatThrownBy(none::cancel).isInstanceOf(UnsupportedOperationException.class);
		assertThat(none.isCancelled()).isFalse();
		assertThatCode(none::throwIfCancelled).doesNotThrowAnyException();
	}

	@Test
	void testInterruptedThreadCountsAsCancelled() {
		// Given
		CancellationSignal signal = CancellationSignal.create();
		Thread.currentThread().interrupt();

		try {
			// When/Then
			assertThatThrownBy(signal::throwIfCancelled)
					.isInstanceOf(CancellationException.class)
					.hasMessageContaining("interrupted");
		} finally {
			// Clear the flag for the following tests
			Thread.interrupted();
		}
	}
}
