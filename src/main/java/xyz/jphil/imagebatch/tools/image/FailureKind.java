package xyz.jphil.imagebatch.tools.image;

/**
 * Pipeline step a per-image failure happened in.
 */
public enum FailureKind {
    DECODE("decode"),
    OPERATION("operation"),
    SAVE("save");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
