package xyz.jphil.imagebatch.tools.batch;

/**
 * Invalid destination, naming expression or format, or outputs that would
 * overwrite each other. Raised before any image is written.
 */
public class ConfigurationException extends BatchException {

    public ConfigurationException(String message) {
        super(message);
    }
}
