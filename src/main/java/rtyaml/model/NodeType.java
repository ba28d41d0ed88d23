package rtyaml.model;

public enum NodeType {
    SCALAR, MAP, SEQ
}
