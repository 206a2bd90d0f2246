package cn.bitsleep.recipebook.web;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One-time notice shown to the caller on the next rendered page.
 */
@Getter
@AllArgsConstructor
public class Flash {
    private final String type;
    private final String message;

    public static Flash success(String message) { return new Flash("success", message); }
    public static Flash warning(String message) { return new Flash("warning", message); }
    public static Flash error(String message) { return new Flash("error", message); }
}
