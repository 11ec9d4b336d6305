package borg.screenmatch.worker;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pool of {@link Worker} threads sharing one bounded FIFO queue. The number of workers grows with the
 * backlog up to a ceiling that can be changed at runtime. Workers that stay idle retire on their own.
 * <p>
 * A stopped pool keeps its queued tasks. They are picked up again after {@link #start()}.
 */
public class DynamicWorkerPool {

	static final Logger logger = LoggerFactory.getLogger(DynamicWorkerPool.class);

	public static final long DEFAULT_IDLE_KEEP_ALIVE_MILLIS = 2000;

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition idle = this.lock.newCondition();

	private final BlockingDeque<Task> taskQueue;
	private final long idleKeepAliveMillis;
	private final List<Worker> workers = new ArrayList<>();
	private final List<TaskFailureListener> failureListeners = new CopyOnWriteArrayList<>();

	private final AtomicLong submittedTasks = new AtomicLong();
	private final AtomicLong failedTasks = new AtomicLong();

	private int maxWorkers;
	private int nextWorkerId = 0;
	/** Queued plus running tasks */
	private int unfinishedTasks = 0;
	private int busyWorkers = 0;
	private boolean stopped = false;
	private boolean shutdown = false;

	public DynamicWorkerPool(int maxWorkers, int queueCapacity) {
		this(maxWorkers, queueCapacity, DEFAULT_IDLE_KEEP_ALIVE_MILLIS);
	}

	public DynamicWorkerPool(int maxWorkers, int queueCapacity, long idleKeepAliveMillis) {
		if (queueCapacity <= 0) {
			throw new IllegalArgumentException("Queue capacity must be positive, got " + queueCapacity);
		}
		if (idleKeepAliveMillis <= 0) {
			throw new IllegalArgumentException("Idle keep-alive must be positive, got " + idleKeepAliveMillis);
		}
		this.maxWorkers = Math.max(1, maxWorkers);
		this.taskQueue = new LinkedBlockingDeque<>(queueCapacity);
		this.idleKeepAliveMillis = idleKeepAliveMillis;
	}

	/**
	 * Lets workers pick up tasks again. Has no effect while workers are active.
	 */
	public void start() {
		this.lock.lock();
		try {
			if (this.shutdown) {
				throw new IllegalStateException("Pool has been shut down");
			}
			if (this.workers.isEmpty()) {
				this.stopped = false;
				this.ensureWorkers(this.taskQueue.size());
			}
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * Signals all workers to halt and returns immediately. Queued tasks stay in the queue.
	 */
	public void stop() {
		this.lock.lock();
		try {
			for (Worker worker : this.workers) {
				worker.halt();
			}
			if (!this.workers.isEmpty()) {
				logger.debug("Stopped " + this.workers.size() + " worker(s), " + this.taskQueue.size() + " task(s) left in queue");
			}
			this.workers.clear();
			this.stopped = true;
			this.idle.signalAll();
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * Final stop. The pool does not accept tasks afterwards.
	 */
	public void shutdown() {
		this.lock.lock();
		try {
			this.shutdown = true;
		} finally {
			this.lock.unlock();
		}
		this.stop();
	}

	/**
	 * Enqueues the task. Blocks only while the queue is full.
	 */
	public void submitTask(Task task) throws InterruptedException {
		this.lock.lock();
		try {
			if (this.shutdown) {
				throw new IllegalStateException("Pool has been shut down, cannot accept " + task);
			}
			this.unfinishedTasks++;
			this.ensureWorkers(this.unfinishedTasks);
		} finally {
			this.lock.unlock();
		}

		try {
			this.taskQueue.putLast(task);
			this.submittedTasks.incrementAndGet();
		} catch (InterruptedException e) {
			this.lock.lock();
			try {
				this.unfinishedTasks--;
				this.idle.signalAll();
			} finally {
				this.lock.unlock();
			}
			throw e;
		}

		// A worker may have retired between the sizing above and the put
		this.lock.lock();
		try {
			this.ensureWorkers(this.unfinishedTasks);
		} finally {
			this.lock.unlock();
		}
	}

	public void increaseMaxWorkers(int n) {
		if (n <= 0) {
			return;
		}
		this.lock.lock();
		try {
			this.maxWorkers += n;
			logger.debug("Max workers increased by " + n + " to " + this.maxWorkers);
			this.ensureWorkers(this.unfinishedTasks);
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * Lowers the ceiling, never below one. Idle workers above the new ceiling are stopped first. If that is
	 * not enough, busy workers are stopped as well and their running task is abandoned without requeue.
	 */
	public void decreaseMaxWorkers(int n) {
		this.lock.lock();
		try {
			n = Math.min(n, this.maxWorkers - 1);
			if (n <= 0) {
				return;
			}
			this.maxWorkers -= n;
			logger.debug("Max workers decreased by " + n + " to " + this.maxWorkers);

			int excess = this.workers.size() - this.maxWorkers;
			for (Iterator<Worker> it = this.workers.iterator(); it.hasNext() && excess > 0;) {
				Worker worker = it.next();
				if (!worker.isBusy()) {
					worker.halt();
					it.remove();
					excess--;
				}
			}
			for (Iterator<Worker> it = this.workers.iterator(); it.hasNext() && excess > 0;) {
				Worker worker = it.next();
				logger.warn("Stopping busy " + worker.getName() + ", abandoning " + worker.getCurrentTask());
				worker.halt();
				it.remove();
				excess--;
			}
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * Blocks until the queue is empty and no task is running. On a stopped pool only the running tasks are
	 * waited for, as queued ones will not be picked up before the next start.
	 */
	public void await() throws InterruptedException {
		this.lock.lock();
		try {
			while (this.stopped ? this.busyWorkers > 0 : this.unfinishedTasks > 0) {
				this.idle.await();
			}
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * Drops all queued tasks which have not been started yet. Running tasks are not touched.
	 *
	 * @return The number of dropped tasks
	 */
	public int clearTaskQueue() {
		this.lock.lock();
		try {
			List<Task> dropped = new ArrayList<>();
			this.taskQueue.drainTo(dropped);
			this.unfinishedTasks -= dropped.size();
			this.idle.signalAll();
			return dropped.size();
		} finally {
			this.lock.unlock();
		}
	}

	public int getMaxWorkers() {
		this.lock.lock();
		try {
			return this.maxWorkers;
		} finally {
			this.lock.unlock();
		}
	}

	public int getActiveWorkers() {
		this.lock.lock();
		try {
			return this.workers.size();
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * True while tasks are queued or running. Use {@link #await()} instead of polling this.
	 */
	public boolean isWorking() {
		this.lock.lock();
		try {
			return this.unfinishedTasks > 0;
		} finally {
			this.lock.unlock();
		}
	}

	public boolean isStopped() {
		this.lock.lock();
		try {
			return this.stopped;
		} finally {
			this.lock.unlock();
		}
	}

	public int getQueuedTaskCount() {
		return this.taskQueue.size();
	}

	public long getSubmittedTaskCount() {
		return this.submittedTasks.get();
	}

	public long getFailedTaskCount() {
		return this.failedTasks.get();
	}

	public void addFailureListener(TaskFailureListener listener) {
		if (listener != null && !this.failureListeners.contains(listener)) {
			this.failureListeners.add(listener);
		}
	}

	public void removeFailureListener(TaskFailureListener listener) {
		if (listener != null) {
			this.failureListeners.remove(listener);
		}
	}

	/**
	 * Adds workers while the backlog per worker exceeds one. Must be called with the lock held.
	 */
	private void ensureWorkers(int pendingTasks) {
		while (!this.stopped && !this.shutdown && this.workers.size() < this.maxWorkers && pendingTasks > 0
				&& (this.workers.isEmpty() || pendingTasks > this.workers.size())) {
			Worker worker = new Worker(this.nextWorkerId++, this, this.taskQueue, this.idleKeepAliveMillis);
			this.workers.add(worker);
			worker.start();
		}
	}

	// >>>> Callbacks from the workers >>>>

	boolean beginTask(Worker worker, Task task) {
		this.lock.lock();
		try {
			if (worker.isShutdown()) {
				// Taken after the halt signal, give it back for the next start
				if (!this.taskQueue.offerFirst(task)) {
					logger.warn("Queue full, dropping " + task + " taken by halted " + worker.getName());
					this.unfinishedTasks--;
					this.idle.signalAll();
				} else {
					// The pool may have been restarted meanwhile, with an empty queue and no workers
					this.ensureWorkers(this.unfinishedTasks);
				}
				return false;
			}
			worker.setCurrentTask(task);
			this.busyWorkers++;
			return true;
		} finally {
			this.lock.unlock();
		}
	}

	void endTask(Worker worker, Task task) {
		this.lock.lock();
		try {
			worker.setCurrentTask(null);
			this.busyWorkers--;
			this.unfinishedTasks--;
			this.idle.signalAll();
		} finally {
			this.lock.unlock();
		}
	}

	void taskFailed(Worker worker, Task task, Exception e) {
		this.failedTasks.incrementAndGet();
		logger.error(worker.getName() + " failed to execute " + task, e);
		for (TaskFailureListener listener : this.failureListeners) {
			try {
				listener.onTaskFailure(task, e);
			} catch (RuntimeException le) {
				logger.error("Failure listener " + listener + " threw", le);
			}
		}
	}

	boolean retireIfIdle(Worker worker) {
		this.lock.lock();
		try {
			if (this.taskQueue.isEmpty() && this.workers.remove(worker)) {
				this.idle.signalAll();
				return true;
			}
			return false;
		} finally {
			this.lock.unlock();
		}
	}

	void workerExited(Worker worker) {
		this.lock.lock();
		try {
			this.workers.remove(worker);
			this.idle.signalAll();
		} finally {
			this.lock.unlock();
		}
	}

	// <<<< Callbacks from the workers <<<<

}
