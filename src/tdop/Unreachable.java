package tdop;

public class Unreachable extends RuntimeException {
	public Unreachable() {
		super("unreachable");
	}

	public Unreachable(String reason) {
		super("unreachable: " + reason);
	}

	public Unreachable(Exception e) {
		super("unreachable", e);
	}
}
