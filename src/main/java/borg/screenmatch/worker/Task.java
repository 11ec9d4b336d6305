package borg.screenmatch.worker;

import java.util.concurrent.Callable;

/**
 * Unit of work for the {@link DynamicWorkerPool}. The body either returns a result or throws; either way
 * the worker moves on to the next task.
 */
public class Task {

	private final int id;
	private final String name;
	private final Callable<?> body;

	public Task(int id, String name, Callable<?> body) {
		if (body == null) {
			throw new IllegalArgumentException("Task body must not be null");
		}
		this.id = id;
		this.name = name;
		this.body = body;
	}

	public Task(int id, Callable<?> body) {
		this(id, "task-" + id, body);
	}

	public Object execute() throws Exception {
		return this.body.call();
	}

	public int getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	@Override
	public String toString() {
		return this.name + " (#" + this.id + ")";
	}

}
