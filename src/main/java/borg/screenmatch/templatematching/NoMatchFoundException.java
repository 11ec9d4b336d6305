package borg.screenmatch.templatematching;

/**
 * No window scored within the threshold before the timeout. Does not tell whether the template is absent or
 * the search was too slow.
 */
public class NoMatchFoundException extends Exception {

	private static final long serialVersionUID = 3309212440961527644L;

	private final long timeoutMillis;

	public NoMatchFoundException(long timeoutMillis) {
		super("No match found within " + timeoutMillis + " ms");
		this.timeoutMillis = timeoutMillis;
	}

	public long getTimeoutMillis() {
		return timeoutMillis;
	}

}
