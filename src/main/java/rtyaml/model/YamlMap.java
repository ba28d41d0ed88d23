package rtyaml.model;

import java.util.Objects;
import java.util.Optional;

public final class YamlMap extends Collection<Pair> {
    @Override
    public NodeType getType() {
        return NodeType.MAP;
    }

    public Optional<Pair> getPair(String key) {
        return getItems().stream().filter(pair -> keyMatches(pair.getKey(), key)).findFirst();
    }

    public Object get(String key) {
        return getPair(key).map(Pair::getValue).orElse(null);
    }

    public void put(Object key, Object value) {
        add(new Pair(key, value));
    }

    private static boolean keyMatches(Object candidate, String key) {
        if (candidate instanceof Scalar scalar) {
            return Objects.equals(scalar.getValue(), key);
        }

        return Objects.equals(candidate, key);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof YamlMap other && getItems().equals(other.getItems())
                && commentsEqual(other);
    }

    @Override
    public int hashCode() {
        return getItems().hashCode();
    }

    @Override
    public String toString() {
        return "YamlMap" + getItems();
    }
}
