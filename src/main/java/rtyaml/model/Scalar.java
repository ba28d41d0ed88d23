package rtyaml.model;

import java.util.Objects;

public final class Scalar extends Node {
    private String value;

    private ScalarStyle style;

    private Chomping chomping = Chomping.CLIP;

    public Scalar(String value) {
        this(value, ScalarStyle.PLAIN);
    }

    public Scalar(String value, ScalarStyle style) {
        this.value = value;
        this.style = Objects.requireNonNull(style);
    }

    @Override
    public NodeType getType() {
        return NodeType.SCALAR;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
        invalidateRange();
    }

    public ScalarStyle getStyle() {
        return style;
    }

    public void setStyle(ScalarStyle style) {
        this.style = Objects.requireNonNull(style);
    }

    public Chomping getChomping() {
        return chomping;
    }

    public void setChomping(Chomping chomping) {
        this.chomping = Objects.requireNonNull(chomping);
    }

    public boolean isKeepChomping() {
        return style.isBlock() && chomping == Chomping.KEEP;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Scalar other)) {
            return false;
        }

        return Objects.equals(value, other.value) && style == other.style
                && chomping == other.chomping && commentsEqual(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, style, chomping);
    }

    @Override
    public String toString() {
        return "Scalar[" + style + ", " + value + "]";
    }
}
