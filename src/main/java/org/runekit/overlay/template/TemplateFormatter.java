package org.runekit.overlay.template;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.StringJoiner;

import org.runekit.overlay.template.ModelValue.Flag;
import org.runekit.overlay.template.ModelValue.Num;
import org.runekit.overlay.template.ModelValue.Text;

/**
 * Evaluates text templates against a {@link TextModel}.
 * <p>
 * Template syntax, as used by overlay scripts:
 * <ul>
 *   <li>{@code {self.path}} inserts a model field. The path is a chain of {@code .name}
 *       attribute steps and {@code [index]} / {@code [key]} item steps.</li>
 *   <li>{@code {{} and {@code }}} produce literal braces.</li>
 *   <li>{@code !s} / {@code !r} convert the value to its display or quoted form first.</li>
 *   <li>{@code :spec} formats the value with
 *       {@code [[fill]align][sign][#][0][width][,|_][.precision][type]}, type being one of
 *       {@code s d n x X o b c e E f F g G %}.</li>
 * </ul>
 * Scalars display like the scripts expect: {@code True}, {@code None}, {@code 1.0}.
 * <p>
 * <strong>Thread Safety:</strong> Stateless, thread-safe.
 */
public final class TemplateFormatter {

    /** The only top-level name a field may reference. */
    public static final String ROOT_NAME = "self";

    private TemplateFormatter() {
        // Utility class
    }

    /**
     * Formats a template.
     *
     * @param template the template text.
     * @param model    the model {@code self} refers to.
     * @return the formatted text.
     * @throws TemplateException if the template is malformed or references a missing field.
     */
    public static String format(String template, TextModel model) {
        StringBuilder out = new StringBuilder(template.length());
        int i = 0;
        int n = template.length();
        while (i < n) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < n && template.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int end = fieldEnd(template, i + 1);
                out.append(renderField(template.substring(i + 1, end), model));
                i = end + 1;
            } else if (c == '}') {
                if (i + 1 < n && template.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new TemplateException("Single '}' encountered in format string");
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int fieldEnd(String template, int start) {
        boolean inBracket = false;
        for (int i = start; i < template.length(); i++) {
            char c = template.charAt(i);
            if (inBracket) {
                inBracket = c != ']';
            } else if (c == '[') {
                inBracket = true;
            } else if (c == '{') {
                throw new TemplateException("Nested replacement fields are not supported");
            } else if (c == '}') {
                return i;
            }
        }
        throw new TemplateException("expected '}' before end of string");
    }

    private static String renderField(String field, TextModel model) {
        int nameEnd = 0;
        boolean inBracket = false;
        while (nameEnd < field.length()) {
            char c = field.charAt(nameEnd);
            if (inBracket) {
                inBracket = c != ']';
            } else if (c == '[') {
                inBracket = true;
            } else if (c == '!' || c == ':') {
                break;
            }
            nameEnd++;
        }

        ModelValue value = resolve(field.substring(0, nameEnd), model);

        String spec = "";
        int rest = nameEnd;
        if (rest < field.length() && field.charAt(rest) == '!') {
            if (rest + 1 >= field.length()) {
                throw new TemplateException("end of string while looking for conversion specifier");
            }
            value = convert(value, field.charAt(rest + 1));
            rest += 2;
            if (rest < field.length() && field.charAt(rest) != ':') {
                throw new TemplateException("expected ':' after conversion specifier");
            }
        }
        if (rest < field.length()) {
            spec = field.substring(rest + 1);
        }
        return formatValue(value, spec);
    }

    private static ModelValue convert(ModelValue value, char conversion) {
        return switch (conversion) {
            case 's' -> new Text(str(value));
            case 'r', 'a' -> new Text(repr(value));
            default -> throw new TemplateException("Unknown conversion specifier " + conversion);
        };
    }

    /**
     * Resolves a field path such as {@code self.players[0].name}.
     */
    static ModelValue resolve(String path, TextModel model) {
        int i = 0;
        while (i < path.length() && path.charAt(i) != '.' && path.charAt(i) != '[') {
            i++;
        }
        String root = path.substring(0, i);
        if (root.isEmpty() || root.chars().allMatch(Character::isDigit)) {
            throw new TemplateException("Positional fields are not supported, use {" + ROOT_NAME + ".name}");
        }
        if (!ROOT_NAME.equals(root)) {
            throw new TemplateException("Unknown name '" + root + "', fields must start with '" + ROOT_NAME + "'");
        }

        ModelValue current = model;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '.') {
                int start = ++i;
                while (i < path.length() && path.charAt(i) != '.' && path.charAt(i) != '[') {
                    i++;
                }
                String attribute = path.substring(start, i);
                if (attribute.isEmpty()) {
                    throw new TemplateException("Empty attribute in format string");
                }
                current = attribute(current, attribute);
            } else if (c == '[') {
                int close = path.indexOf(']', i);
                if (close < 0) {
                    throw new TemplateException("Missing ']' in format string");
                }
                String key = path.substring(i + 1, close);
                if (key.isEmpty()) {
                    throw new TemplateException("Empty attribute in format string");
                }
                current = item(current, key);
                i = close + 1;
                if (i < path.length() && path.charAt(i) != '.' && path.charAt(i) != '[') {
                    throw new TemplateException("Only '.' or '[' may follow ']' in format field specifier");
                }
            } else {
                throw new TemplateException("Invalid field path '" + path + "'");
            }
        }
        return current;
    }

    private static ModelValue attribute(ModelValue target, String name) {
        if (target instanceof TextModel model) {
            return model.get(name).orElseThrow(() -> new TemplateException(
                    "'" + typeName(target) + "' object has no attribute '" + name + "'"));
        }
        throw new TemplateException("'" + typeName(target) + "' object has no attribute '" + name + "'");
    }

    private static ModelValue item(ModelValue target, String key) {
        boolean numeric = key.chars().allMatch(Character::isDigit);
        if (target instanceof ModelList list) {
            if (!numeric) {
                throw new TemplateException("list indices must be integers, not '" + key + "'");
            }
            try {
                return list.get(Integer.parseInt(key));
            } catch (NumberFormatException e) {
                throw new TemplateException("list index out of range: " + key, e);
            }
        }
        if (target instanceof TextModel model) {
            return model.get(key).orElseThrow(() -> new TemplateException("Missing key '" + key + "'"));
        }
        throw new TemplateException("'" + typeName(target) + "' object is not subscriptable");
    }

    // --- display forms ---

    /**
     * @return the display form of a value, as a script's {@code str()} would produce it.
     */
    public static String str(ModelValue value) {
        if (value instanceof Text t) {
            return t.value();
        }
        if (value instanceof Num n) {
            return n.isIntegral() ? Long.toString(n.longValue()) : floatRepr(n.doubleValue());
        }
        if (value instanceof Flag f) {
            return f.value() ? "True" : "False";
        }
        if (value instanceof ModelValue.Null) {
            return "None";
        }
        return repr(value);
    }

    /**
     * @return the quoted form of a value, as a script's {@code repr()} would produce it.
     */
    public static String repr(ModelValue value) {
        if (value instanceof Text t) {
            return quote(t.value());
        }
        if (value instanceof ModelList list) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (ModelValue item : list.items()) {
                joiner.add(repr(item));
            }
            return joiner.toString();
        }
        if (value instanceof TextModel model) {
            StringJoiner joiner = new StringJoiner(", ", "TextModel(", ")");
            model.fields().forEach((key, field) -> joiner.add(key + "=" + repr(field)));
            return joiner.toString();
        }
        return str(value);
    }

    private static String quote(String s) {
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(s.length() + 2).append(quote);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * Shortest round-trip decimal form; scientific notation outside {@code [1e-4, 1e16)}.
     */
    static String floatRepr(double d) {
        if (Double.isNaN(d)) {
            return "nan";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "inf" : "-inf";
        }
        if (d == 0.0) {
            return (1 / d) < 0 ? "-0.0" : "0.0";
        }
        String sign = d < 0 ? "-" : "";
        BigDecimal bd = new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
        String digits = bd.unscaledValue().toString();
        int exponent = digits.length() - 1 - bd.scale();
        if (exponent >= -4 && exponent < 16) {
            String plain = bd.toPlainString();
            return sign + (plain.indexOf('.') < 0 ? plain + ".0" : plain);
        }
        String mantissa = digits.length() > 1 ? digits.charAt(0) + "." + digits.substring(1) : digits;
        return sign + mantissa + exponentSuffix('e', exponent);
    }

    private static String exponentSuffix(char e, int exponent) {
        return e + (exponent < 0 ? "-" : "+") + (Math.abs(exponent) < 10 ? "0" : "") + Math.abs(exponent);
    }

    private static String typeName(ModelValue value) {
        if (value instanceof Text) {
            return "str";
        }
        if (value instanceof Num n) {
            return n.isIntegral() ? "int" : "float";
        }
        if (value instanceof Flag) {
            return "bool";
        }
        if (value instanceof ModelValue.Null) {
            return "NoneType";
        }
        if (value instanceof ModelList) {
            return "list";
        }
        return "TextModel";
    }

    // --- format specs ---

    private record Spec(Character fill, Character align, char sign, boolean alternate, boolean zero,
                        int width, Character grouping, Integer precision, Character type) {

        static Spec parse(String spec) {
            int i = 0;
            int n = spec.length();
            Character fill = null;
            Character align = null;
            if (n >= 2 && "<>=^".indexOf(spec.charAt(1)) >= 0) {
                fill = spec.charAt(0);
                align = spec.charAt(1);
                i = 2;
            } else if (n >= 1 && "<>=^".indexOf(spec.charAt(0)) >= 0) {
                align = spec.charAt(0);
                i = 1;
            }
            char sign = '-';
            if (i < n && "+- ".indexOf(spec.charAt(i)) >= 0) {
                sign = spec.charAt(i++);
            }
            boolean alternate = false;
            if (i < n && spec.charAt(i) == '#') {
                alternate = true;
                i++;
            }
            boolean zero = false;
            if (i < n && spec.charAt(i) == '0') {
                zero = true;
                i++;
            }
            int widthStart = i;
            while (i < n && Character.isDigit(spec.charAt(i))) {
                i++;
            }
            int width = i > widthStart ? parseCount(spec.substring(widthStart, i)) : 0;
            Character grouping = null;
            if (i < n && (spec.charAt(i) == ',' || spec.charAt(i) == '_')) {
                grouping = spec.charAt(i++);
            }
            Integer precision = null;
            if (i < n && spec.charAt(i) == '.') {
                int precisionStart = ++i;
                while (i < n && Character.isDigit(spec.charAt(i))) {
                    i++;
                }
                if (i == precisionStart) {
                    throw new TemplateException("Format specifier missing precision");
                }
                precision = parseCount(spec.substring(precisionStart, i));
            }
            if (n - i > 1) {
                throw new TemplateException("Invalid format specifier '" + spec + "'");
            }
            Character type = i < n ? spec.charAt(i) : null;
            if (zero && fill == null) {
                fill = '0';
                if (align == null) {
                    align = '=';
                }
            }
            return new Spec(fill, align, sign, alternate, zero, width, grouping, precision, type);
        }

        private static int parseCount(String digits) {
            try {
                return Integer.parseInt(digits);
            } catch (NumberFormatException e) {
                throw new TemplateException("Too many decimal digits in format string", e);
            }
        }

        boolean explicitSign() {
            return sign != '-';
        }
    }

    private static String formatValue(ModelValue value, String specText) {
        if (specText.isEmpty()) {
            return str(value);
        }
        Spec spec = Spec.parse(specText);
        if (value instanceof Text text) {
            return formatString(text.value(), spec);
        }
        if (value instanceof Flag flag) {
            return formatNumber(Num.of(flag.value() ? 1L : 0L), spec, "bool");
        }
        if (value instanceof Num num) {
            return formatNumber(num, spec, typeName(num));
        }
        throw new TemplateException("unsupported format string passed to " + typeName(value) + ".__format__");
    }

    private static String formatString(String value, Spec spec) {
        if (spec.type() != null && spec.type() != 's') {
            throw new TemplateException("Unknown format code '" + spec.type() + "' for object of type 'str'");
        }
        if (spec.explicitSign()) {
            throw new TemplateException("Sign not allowed in string format specifier");
        }
        if (spec.alternate()) {
            throw new TemplateException("Alternate form (#) not allowed in string format specifier");
        }
        if (spec.grouping() != null) {
            throw new TemplateException("Cannot specify '" + spec.grouping() + "' with 's'.");
        }
        Character align = spec.align();
        if (align != null && align == '=') {
            if (!spec.zero()) {
                throw new TemplateException("'=' alignment not allowed in string format specifier");
            }
            align = '<';
        }
        String body = spec.precision() != null && spec.precision() < value.length()
                ? value.substring(0, spec.precision())
                : value;
        return pad("", body, spec, align == null ? '<' : align);
    }

    private static String formatNumber(Num num, Spec spec, String typeName) {
        char type = spec.type() == null ? 0 : spec.type();
        boolean negative;
        String prefix = "";
        String body;

        if (num.isIntegral() && (type == 0 || "dnxXobc".indexOf(type) >= 0)) {
            if (spec.precision() != null) {
                throw new TemplateException("Precision not allowed in integer format specifier");
            }
            long v = num.longValue();
            negative = v < 0;
            String magnitude = v == Long.MIN_VALUE ? "9223372036854775808" : Long.toString(Math.abs(v));
            switch (type) {
                case 'x', 'X' -> {
                    body = Long.toHexString(Math.abs(v));
                    prefix = spec.alternate() ? "0x" : "";
                }
                case 'o' -> {
                    body = Long.toOctalString(Math.abs(v));
                    prefix = spec.alternate() ? "0o" : "";
                }
                case 'b' -> {
                    body = Long.toBinaryString(Math.abs(v));
                    prefix = spec.alternate() ? "0b" : "";
                }
                case 'c' -> {
                    if (v < 0 || v > Character.MAX_CODE_POINT) {
                        throw new TemplateException("%c arg not in range(0x110000)");
                    }
                    negative = false;
                    body = new String(Character.toChars((int) v));
                }
                default -> body = magnitude;
            }
            if (type == 'X') {
                body = body.toUpperCase(Locale.ROOT);
                prefix = prefix.toUpperCase(Locale.ROOT);
            }
            body = group(body, spec, type);
        } else if ("eEfFgGn%".indexOf(type) >= 0 || type == 0) {
            double v = num.doubleValue();
            negative = v < 0 || (v == 0.0 && 1 / v < 0);
            double abs = Math.abs(v);
            if (Double.isNaN(v)) {
                negative = false;
                body = "nan";
            } else if (Double.isInfinite(v)) {
                body = "inf";
            } else if (type == 0 && spec.precision() == null) {
                body = floatRepr(abs);
            } else {
                body = formatFloat(abs, type == 0 || type == 'n' ? 'g' : type, spec.precision(), spec.alternate());
            }
            if (Character.isUpperCase(type)) {
                body = body.toUpperCase(Locale.ROOT);
            }
            body = group(body, spec, 'd');
        } else {
            throw new TemplateException("Unknown format code '" + type + "' for object of type '" + typeName + "'");
        }

        String sign = negative ? "-" : switch (spec.sign()) {
            case '+' -> "+";
            case ' ' -> " ";
            default -> "";
        };
        return pad(sign + prefix, body, spec, spec.align() == null ? '>' : spec.align());
    }

    private static String formatFloat(double abs, char type, Integer precision, boolean alternate) {
        BigDecimal exact = new BigDecimal(abs);
        switch (type) {
            case 'f', 'F' -> {
                int p = precision == null ? 6 : precision;
                String fixed = exact.setScale(p, RoundingMode.HALF_EVEN).toPlainString();
                return p == 0 && alternate ? fixed + "." : fixed;
            }
            case '%' -> {
                int p = precision == null ? 6 : precision;
                String fixed = exact.multiply(BigDecimal.valueOf(100)).setScale(p, RoundingMode.HALF_EVEN)
                        .toPlainString();
                return (p == 0 && alternate ? fixed + "." : fixed) + "%";
            }
            case 'e', 'E' -> {
                int p = precision == null ? 6 : precision;
                return scientific(exact, p, alternate);
            }
            default -> {
                int p = precision == null ? 6 : Math.max(1, precision);
                int exponent = abs == 0.0 ? 0 : decimalExponent(exact.round(new MathContext(p, RoundingMode.HALF_EVEN)));
                String result = exponent >= -4 && exponent < p
                        ? exact.setScale(p - 1 - exponent, RoundingMode.HALF_EVEN).toPlainString()
                        : scientific(exact, p - 1, alternate);
                return alternate ? result : stripZeros(result);
            }
        }
    }

    private static String scientific(BigDecimal exact, int precision, boolean alternate) {
        String digits;
        int exponent;
        if (exact.signum() == 0) {
            digits = "0".repeat(precision + 1);
            exponent = 0;
        } else {
            BigDecimal rounded = exact.round(new MathContext(precision + 1, RoundingMode.HALF_EVEN));
            exponent = decimalExponent(rounded);
            digits = rounded.unscaledValue().toString();
            if (digits.length() < precision + 1) {
                digits = digits + "0".repeat(precision + 1 - digits.length());
            } else if (digits.length() > precision + 1) {
                digits = digits.substring(0, precision + 1);
            }
        }
        String mantissa = digits.substring(0, 1);
        if (precision > 0 || alternate) {
            mantissa += "." + digits.substring(1);
        }
        return mantissa + exponentSuffix('e', exponent);
    }

    private static int decimalExponent(BigDecimal value) {
        return value.precision() - 1 - value.scale();
    }

    private static String stripZeros(String number) {
        int e = number.indexOf('e');
        String mantissa = e < 0 ? number : number.substring(0, e);
        String suffix = e < 0 ? "" : number.substring(e);
        if (mantissa.indexOf('.') >= 0) {
            mantissa = mantissa.replaceAll("0+$", "");
            if (mantissa.endsWith(".")) {
                mantissa = mantissa.substring(0, mantissa.length() - 1);
            }
        }
        return mantissa + suffix;
    }

    private static String group(String body, Spec spec, char type) {
        Character separator = spec.grouping();
        if (separator == null) {
            return body;
        }
        boolean radix = "xXob".indexOf(type) >= 0;
        if (radix && separator == ',') {
            throw new TemplateException("Cannot specify ',' with '" + type + "'.");
        }
        if (type == 'c') {
            throw new TemplateException("Cannot specify '" + separator + "' with 'c'.");
        }
        int digitsEnd = 0;
        while (digitsEnd < body.length() && Character.isLetterOrDigit(body.charAt(digitsEnd))
                && (radix || Character.isDigit(body.charAt(digitsEnd)))) {
            digitsEnd++;
        }
        String digits = body.substring(0, digitsEnd);
        int size = radix ? 4 : 3;
        StringBuilder grouped = new StringBuilder();
        for (int i = 0; i < digits.length(); i++) {
            if (i > 0 && (digits.length() - i) % size == 0) {
                grouped.append(separator);
            }
            grouped.append(digits.charAt(i));
        }
        return grouped + body.substring(digitsEnd);
    }

    private static String pad(String signAndPrefix, String body, Spec spec, char align) {
        int length = signAndPrefix.length() + body.length();
        if (length >= spec.width()) {
            return signAndPrefix + body;
        }
        String fill = String.valueOf(spec.fill() == null ? ' ' : spec.fill()).repeat(spec.width() - length);
        return switch (align) {
            case '<' -> signAndPrefix + body + fill;
            case '^' -> {
                int left = fill.length() / 2;
                yield fill.substring(0, left) + signAndPrefix + body + fill.substring(left);
            }
            case '=' -> signAndPrefix + fill + body;
            default -> fill + signAndPrefix + body;
        };
    }
}
