package cn.bitsleep.recipebook.domain;

public enum Role {
    USER,
    ADMIN;

    public String authority() { return "ROLE_" + name(); }
}
