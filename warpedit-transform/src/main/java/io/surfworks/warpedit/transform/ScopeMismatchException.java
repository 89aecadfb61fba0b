package io.surfworks.warpedit.transform;

/**
 * Thrown when an operation name does not lie under the source scope of a transformation,
 * so no destination name can be derived for it.
 */
public class ScopeMismatchException extends GraphEditException {

    private final String name;
    private final String scope;

    public ScopeMismatchException(String name, String scope) {
        super(String.format("%s does not belong to source scope: %s", name, scope));
        this.name = name;
        this.scope = scope;
    }

    public String getName() {
        return name;
    }

    public String getScope() {
        return scope;
    }
}
