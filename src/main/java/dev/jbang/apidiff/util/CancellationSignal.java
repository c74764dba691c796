package dev.jbang.apidiff.util;

import java.util.concurrent.CancellationException;

/** Cooperative cancellation flag checked by long running loops */
public final class CancellationSignal {
	private static final CancellationSignal NONE = new CancellationSignal(false);

	private final boolean cancellable;
	private final CancellationSignal parent;
	private volatile boolean cancelled;

	private CancellationSignal(boolean cancellable) {
		this(cancellable, null);
	}

	private CancellationSignal(boolean cancellable, CancellationSignal parent) {
		this.cancellable = cancellable;
		this.parent = parent;
	}

	public static CancellationSignal create() {
		return new CancellationSignal(true);
	}

	/** A signal that is never cancelled */
	public static CancellationSignal none() {
		return NONE;
	}

	/** A signal that is cancelled together with this one, but can also be cancelled on its own */
	public CancellationSignal child() {
		return new CancellationSignal(true, this);
	}

	public void cancel() {
		if (!cancellable) {
			throw new UnsupportedOperationException("This signal cannot be cancelled");
		}
		cancelled = true;
	}

	public boolean isCancelled() {
		return cancelled || (parent != null && parent.isCancelled());
	}

	/**
	 * @throws CancellationException if the signal was cancelled or the current thread interrupted
	 */
	public void throwIfCancelled() {
		if (isCancelled()) {
			throw new CancellationException("Operation cancelled");
		}
		if (Thread.currentThread().isInterrupted()) {
			throw new CancellationException("Operation interrupted");
		}
	}
}
