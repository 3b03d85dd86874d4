package tdop;

/**
 * Invalid command line options or configuration file.
 */
public class TDOPOptionException extends TDOPException {

	private static final String prefix = "Option error";

	public TDOPOptionException(String msg) {
		super(prefix, msg);
	}

	public TDOPOptionException(String msg, Throwable cause) {
		super(prefix, msg, cause);
	}
}
