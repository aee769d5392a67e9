package org.javai.pegtree.tree.config;

/**
 * Exception thrown when a tree selection configuration cannot be loaded.
 */
public class TreeConfigurationException extends RuntimeException {

	public TreeConfigurationException(String message) {
		super(message);
	}

	public TreeConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
