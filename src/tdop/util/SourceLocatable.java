package tdop.util;

/**
 * 
 * A common abstract base, typically meant for tokens, that should be
 * implemented by anything that needs to be traced back to its
 * original location in the parsed source.
 *
 */
public abstract class SourceLocatable {
	
	public abstract SourceLocation getLocation();

}
