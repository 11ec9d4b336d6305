package borg.screenmatch.worker;

import java.util.concurrent.BlockingDeque;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread pulling tasks from the pool's shared queue. A worker only runs once: after it has stopped the pool
 * has to create a new one.
 */
public class Worker extends Thread {

	static final Logger logger = LoggerFactory.getLogger(Worker.class);

	public enum WorkerState {
		IDLE, ACTIVE, STOPPED
	}

	private final int workerId;
	private final DynamicWorkerPool pool;
	private final BlockingDeque<Task> taskQueue;
	private final long idleKeepAliveMillis;

	private volatile boolean shutdown = false;
	private volatile WorkerState workerState = WorkerState.IDLE;
	private volatile Task currentTask = null;

	Worker(int workerId, DynamicWorkerPool pool, BlockingDeque<Task> taskQueue, long idleKeepAliveMillis) {
		this.setName("Worker-" + workerId);
		this.setDaemon(true);

		this.workerId = workerId;
		this.pool = pool;
		this.taskQueue = taskQueue;
		this.idleKeepAliveMillis = idleKeepAliveMillis;
	}

	@Override
	public synchronized void start() {
		if (this.workerState != WorkerState.IDLE) {
			throw new IllegalStateException(this.getName() + " is " + this.workerState + " and cannot be started again");
		}
		this.workerState = WorkerState.ACTIVE;
		super.start();
	}

	@Override
	public void run() {
		logger.info(this.getName() + " started");

		try {
			while (!this.shutdown) {
				Task task = null;
				try {
					task = this.taskQueue.poll(this.idleKeepAliveMillis, TimeUnit.MILLISECONDS);
				} catch (InterruptedException e) {
					// Either halted, then the loop ends, or a stray interrupt
					continue;
				}

				if (task == null) {
					if (this.pool.retireIfIdle(this)) {
						logger.debug(this.getName() + " idle for " + this.idleKeepAliveMillis + " ms, retiring");
						break;
					}
				} else if (this.pool.beginTask(this, task)) {
					this.runTask(task);
				}
			}
		} finally {
			this.workerState = WorkerState.STOPPED;
			this.pool.workerExited(this);
			logger.info(this.getName() + " stopped");
		}
	}

	private void runTask(Task task) {
		try {
			task.execute();
		} catch (Exception e) {
			this.pool.taskFailed(this, task, e);
		} finally {
			this.pool.endTask(this, task);
		}
	}

	/**
	 * Signals the worker to stop. Does not wait. A running task sees the interrupt and is not requeued.
	 */
	public void halt() {
		this.shutdown = true;
		this.interrupt();
	}

	public boolean isShutdown() {
		return shutdown;
	}

	public boolean isBusy() {
		return this.currentTask != null;
	}

	public Task getCurrentTask() {
		return currentTask;
	}

	void setCurrentTask(Task currentTask) {
		this.currentTask = currentTask;
	}

	public int getWorkerId() {
		return workerId;
	}

	public WorkerState getWorkerState() {
		return workerState;
	}

}
