package cn.bitsleep.recipebook.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the two response shapes the page handlers return: a named view with its model,
 * or a 303 redirect carrying flash notices.
 */
public final class Responses {

    private Responses() {}

    public static ResponseEntity<Map<String, Object>> render(String view, Map<String, ?> model) {
        return view(HttpStatus.OK, view, model, null);
    }

    /** Re-renders a form after a failed submission, with the field errors. */
    public static ResponseEntity<Map<String, Object>> renderInvalid(String view, Map<String, ?> model,
                                                                    Map<String, List<String>> errors) {
        return view(HttpStatus.UNPROCESSABLE_ENTITY, view, model, errors);
    }

    public static ResponseEntity<Map<String, Object>> redirect(Route route, Flash... flashes) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("redirect", route.routeName);
        body.put("location", route.path);
        body.put("flashes", List.of(flashes));
        return ResponseEntity.status(HttpStatus.SEE_OTHER)
                .location(URI.create(route.path))
                .body(body);
    }

    public static Map<String, List<String>> errors(BindingResult result) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        for (ObjectError e : result.getAllErrors()) {
            String key = e instanceof FieldError ? ((FieldError) e).getField() : "form";
            errors.computeIfAbsent(key, k -> new ArrayList<>()).add(e.getDefaultMessage());
        }
        return errors;
    }

    private static ResponseEntity<Map<String, Object>> view(HttpStatus status, String view, Map<String, ?> model,
                                                            Map<String, List<String>> errors) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("view", view);
        body.put("model", new LinkedHashMap<>(model));
        if (errors != null) body.put("errors", errors);
        body.put("flashes", List.of());
        return ResponseEntity.status(status).body(body);
    }
}
