package rtyaml.model;

public class InvalidKeyKindException extends IllegalStateException {
    private static final long serialVersionUID = 4118043209843120757L;

    public InvalidKeyKindException(String property, Object key) {
        super(property + " is an alias for the key node's own " + property
                + "; it requires a Node key, found " + key.getClass().getName());
    }
}
