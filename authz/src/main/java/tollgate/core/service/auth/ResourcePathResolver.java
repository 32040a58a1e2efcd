package tollgate.core.service.auth;

import java.util.Map;
import java.util.TreeMap;

/**
 * Resolves resource path templates against request route parameters.
 *
 * <p>Every {@code {name}} placeholder is replaced with the value of the route
 * parameter of the same name, compared case-insensitively. Placeholders without a
 * matching parameter are kept as literal text.
 *
 * <p>Example: {@code customers/{customerId}/orders/{orderId}} with
 * {@code customerId=123, orderId=456} resolves to {@code customers/123/orders/456}.
 */
public final class ResourcePathResolver {

    private ResourcePathResolver() {}

    /**
     * Resolve a template.
     *
     * @param template        the resource path template
     * @param routeParameters route parameter values by name
     * @return the resolved path
     */
    public static String resolve(String template, Map<String, String> routeParameters) {
        if (template == null || template.indexOf('{') < 0 || routeParameters == null || routeParameters.isEmpty()) {
            return template;
        }

        final var parameters = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        parameters.putAll(routeParameters);

        final var result = new StringBuilder(template.length() + 16);
        int position = 0;
        while (position < template.length()) {
            final int open = template.indexOf('{', position);
            if (open < 0) {
                break;
            }
            final int close = template.indexOf('}', open + 1);
            if (close < 0) {
                break;
            }

            final var name = template.substring(open + 1, close);
            result.append(template, position, open);
            if (parameters.containsKey(name)) {
                final var value = parameters.get(name);
                result.append(value != null ? value : "");
            } else {
                result.append(template, open, close + 1);
            }
            position = close + 1;
        }
        result.append(template, position, template.length());
        return result.toString();
    }
}
