package rtyaml.model;

import java.util.ArrayList;
import java.util.List;

public abstract sealed class Collection<T> extends Node permits YamlMap, YamlSeq {
    private final List<T> items = new ArrayList<>();

    private boolean flow;

    public List<T> getItems() {
        return items;
    }

    public void add(T item) {
        items.add(item);
        invalidateRange();
    }

    public T get(int index) {
        return items.get(index);
    }

    public T remove(int index) {
        invalidateRange();
        return items.remove(index);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean isFlow() {
        return flow;
    }

    public void setFlow(boolean flow) {
        this.flow = flow;
    }
}
