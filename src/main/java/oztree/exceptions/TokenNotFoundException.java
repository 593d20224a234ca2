package oztree.exceptions;

import java.util.List;

/**
 * Thrown when a symbolic inclusion token (e.g. AMORPHEA@) has no entry in the token mapping.
 */
public class TokenNotFoundException extends StoredEntityNotFoundException {

	private static final long serialVersionUID = 1L;

	// single name constructor
	public TokenNotFoundException(String token) {
		super(token, "inclusion token", "inclusion tokens");
	}

	// list of names constructor
	public TokenNotFoundException(List<String> tokens){
		super(tokens, "inclusion token", "inclusion tokens");
	}
}
