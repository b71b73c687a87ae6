package diffmigrator.oracle;

import diffmigrator.model.FunctionDecl;
import diffmigrator.model.Parameter;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds parameters that appear as the right operand of {@code /} or {@code %}
 * in a function body.
 */
final class DivisorAnalysis {

    private static final Pattern LINE_COMMENT = Pattern.compile("//[^\n]*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern STRING_LITERAL = Pattern.compile("\"(?:\\\\.|[^\"\\\\])*\"");

    private DivisorAnalysis() {}

    static Set<String> divisorParameters(FunctionDecl function) {
        String body = stripNoise(function.body());
        Set<String> divisors = new LinkedHashSet<>();
        if (body.isEmpty()) return divisors;
        for (Parameter p : function.parameters()) {
            Pattern use = Pattern.compile("[/%]=?\\s*\\(?\\s*" + Pattern.quote(p.name()) + "\\b");
            if (use.matcher(body).find()) {
                divisors.add(p.name());
            }
        }
        return divisors;
    }

    private static String stripNoise(String body) {
        String s = BLOCK_COMMENT.matcher(body).replaceAll(" ");
        s = LINE_COMMENT.matcher(s).replaceAll(" ");
        return STRING_LITERAL.matcher(s).replaceAll("\"\"");
    }
}
