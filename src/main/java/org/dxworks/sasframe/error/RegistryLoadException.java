package org.dxworks.sasframe.error;

/**
 * A rule registry file is missing, unreadable or declares something the engine does not know.
 */
public class RegistryLoadException extends RuntimeException {
    public RegistryLoadException(String message) {
        super(message);
    }

    public RegistryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
