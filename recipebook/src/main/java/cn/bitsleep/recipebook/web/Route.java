package cn.bitsleep.recipebook.web;

/**
 * Named redirect targets.
 */
public enum Route {
    RECIPE_INDEX("recipe_index", "/recipe"),
    APP_LOGIN("app_login", "/login");

    public final String routeName;
    public final String path;

    Route(String routeName, String path) {
        this.routeName = routeName;
        this.path = path;
    }
}
