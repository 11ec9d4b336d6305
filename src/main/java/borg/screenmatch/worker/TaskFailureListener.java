package borg.screenmatch.worker;

public interface TaskFailureListener {

	void onTaskFailure(Task task, Exception exception);

}
