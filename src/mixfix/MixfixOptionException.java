package mixfix;

public class MixfixOptionException extends Exception {
	private static final long serialVersionUID = 4410957301287764017L;

	public MixfixOptionException(String msg) {
		super(msg);
	}
}
