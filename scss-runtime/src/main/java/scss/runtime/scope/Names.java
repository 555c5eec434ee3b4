package scss.runtime.scope;

/**
 * 成员名规则：{@code -} 与 {@code _} 视为相同，以二者之一开头的成员为模块私有
 */
public final class Names {

    private Names() {}

    public static String normalize(String name) {
        return name.indexOf('_') < 0 ? name : name.replace('_', '-');
    }

    public static boolean isPrivate(String name) {
        return !name.isEmpty() && (name.charAt(0) == '-' || name.charAt(0) == '_');
    }
}
