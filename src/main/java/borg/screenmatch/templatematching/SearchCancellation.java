package borg.screenmatch.templatematching;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token of one search. Cancelled explicitly, by reaching the deadline, or by an interrupt of the
 * thread asking.
 */
public class SearchCancellation {

	private final long deadlineNanos;
	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	private SearchCancellation(long deadlineNanos) {
		this.deadlineNanos = deadlineNanos;
	}

	public static SearchCancellation withTimeout(long timeoutMillis) {
		return new SearchCancellation(System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0, timeoutMillis)));
	}

	public void cancel() {
		this.cancelled.set(true);
	}

	public boolean isCancelled() {
		return this.cancelled.get() || this.remainingNanos() <= 0 || Thread.currentThread().isInterrupted();
	}

	public long remainingNanos() {
		return this.deadlineNanos - System.nanoTime();
	}

}
