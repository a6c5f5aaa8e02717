package com.guicedee.rabbitbus.topology;

import com.google.common.base.Strings;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The string pipeline shared by queue, exchange and routing key naming
 */
final class NameTransforms
{
    private static final Pattern INVALID_CHARACTERS = Pattern.compile("[^a-zA-Z0-9._\\-]");

    private NameTransforms()
    {
    }

    /**
     * Removes everything but letters, digits, dots, dashes and underscores, and guards a leading digit with an underscore
     */
    static String sanitize(String raw)
    {
        if (StringUtils.isBlank(raw))
        {
            return "";
        }
        String cleaned = INVALID_CHARACTERS.matcher(raw).replaceAll("");
        if (!cleaned.isEmpty() && Character.isDigit(cleaned.charAt(0)))
        {
            cleaned = "_" + cleaned;
        }
        return cleaned;
    }

    /**
     * The simple name of a type, sanitized. Anonymous and local classes fall back to their binary name.
     */
    static String typeName(Class<?> type)
    {
        String simpleName = type.getSimpleName();
        if (Strings.isNullOrEmpty(simpleName))
        {
            simpleName = StringUtils.substringAfterLast(type.getName(), ".");
            if (simpleName.isEmpty())
            {
                simpleName = type.getName();
            }
        }
        return sanitize(simpleName);
    }

    /**
     * Strips at most one suffix. The longest matching suffix wins, the first listed wins a tie.
     * A name equal to a suffix is left alone.
     */
    static String stripSuffix(String name, List<String> suffixes)
    {
        String match = null;
        for (String suffix : suffixes)
        {
            if (Strings.isNullOrEmpty(suffix) || name.length() <= suffix.length() || !name.endsWith(suffix))
            {
                continue;
            }
            if (match == null || suffix.length() > match.length())
            {
                match = suffix;
            }
        }
        return match == null ? name : name.substring(0, name.length() - match.length());
    }

    /**
     * The last {@code depth} segments of the package of a type, empty for the default package
     */
    static String namespaceTail(Class<?> type, int depth)
    {
        String packageName = type.getPackageName();
        if (Strings.isNullOrEmpty(packageName) || depth < 1)
        {
            return "";
        }
        String[] segments = packageName.split("\\.");
        int from = Math.max(0, segments.length - depth);
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < segments.length; i++)
        {
            if (sb.length() > 0)
            {
                sb.append('.');
            }
            sb.append(segments[i]);
        }
        return sb.toString();
    }

    static String applyCasing(String name, CasingStyle casing, String separator)
    {
        if (Strings.isNullOrEmpty(name))
        {
            return name;
        }
        switch (casing)
        {
            case LowerCase:
                return name.toLowerCase();
            case UpperCase:
                return name.toUpperCase();
            case KebabCase:
                return splitWords(name, separatorOr(separator, "-")).toLowerCase();
            case SnakeCase:
                return splitWords(name, "_").toLowerCase();
            case PascalCase:
                return Character.toUpperCase(name.charAt(0)) + name.substring(1);
            case CamelCase:
                return Character.toLowerCase(name.charAt(0)) + name.substring(1);
            case Preserve:
            default:
                return name;
        }
    }

    private static String separatorOr(String separator, String fallback)
    {
        return "-".equals(separator) || "_".equals(separator) ? separator : fallback;
    }

    /**
     * Inserts the word separator at case boundaries. An upper case run is one token, split only where
     * the next word starts, so {@code HTTPRequest} becomes {@code HTTP-Request}. Existing dashes and
     * underscores become the separator, dots are kept.
     */
    static String splitWords(String name, String separator)
    {
        StringBuilder sb = new StringBuilder(name.length() + 8);
        char previous = 0;
        for (int i = 0; i < name.length(); i++)
        {
            char current = name.charAt(i);
            if (current == '-' || current == '_')
            {
                if (sb.length() > 0 && !isBoundary(previous))
                {
                    sb.append(separator);
                }
                previous = '-';
                continue;
            }
            if (Character.isUpperCase(current) && i > 0 && !isBoundary(previous))
            {
                boolean nextIsLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                if (Character.isLowerCase(previous) || Character.isDigit(previous)
                        || (Character.isUpperCase(previous) && nextIsLower))
                {
                    sb.append(separator);
                }
            }
            sb.append(current);
            previous = current;
        }
        return sb.toString();
    }

    private static boolean isBoundary(char c)
    {
        return c == 0 || c == '-' || c == '_' || c == '.';
    }
}
