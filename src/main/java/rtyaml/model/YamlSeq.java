package rtyaml.model;

public final class YamlSeq extends Collection<Object> {
    @Override
    public NodeType getType() {
        return NodeType.SEQ;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof YamlSeq other && getItems().equals(other.getItems())
                && commentsEqual(other);
    }

    @Override
    public int hashCode() {
        return getItems().hashCode();
    }

    @Override
    public String toString() {
        return "YamlSeq" + getItems();
    }
}
