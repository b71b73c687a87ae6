package diffmigrator.validator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One discrepancy between baseline and target.
 *
 * @param name output name, or {@link #EXECUTION} for case-level failures
 * @param baseline baseline value, null when absent
 * @param target target value, null when absent
 * @param delta absolute numeric difference for finite floating point pairs, else null
 * @param reason why the pair does not match
 * @param detail free-form detail such as a stderr excerpt, may be empty
 */
public record Difference(
        String name,
        OutputValue baseline,
        OutputValue target,
        Double delta,
        ReasonCode reason,
        String detail
) {

    public static final String EXECUTION = "<execution>";

    public Difference {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(reason, "reason");
        detail = detail != null ? detail : "";
    }

    public static Difference of(String name, OutputValue baseline, OutputValue target, ReasonCode reason) {
        return new Difference(name, baseline, target, null, reason, "");
    }

    public static Difference numeric(String name, OutputValue baseline, OutputValue target, double delta) {
        return new Difference(name, baseline, target, delta, ReasonCode.OUTSIDE_TOLERANCE, "");
    }

    public static Difference execution(ReasonCode reason, String detail) {
        return new Difference(EXECUTION, null, null, null, reason, detail);
    }

    /** Single line description, also fed back to the code generator on retry. */
    public String describe() {
        StringBuilder sb = new StringBuilder(name).append(": ");
        if (EXECUTION.equals(name)) {
            sb.append(reason);
            if (!detail.isBlank()) sb.append(" (").append(firstLine(detail)).append(')');
            return sb.toString();
        }
        sb.append("expected ").append(render(baseline)).append(", got ").append(render(target));
        sb.append(" [").append(reason);
        if (delta != null) sb.append(", delta=").append(delta);
        return sb.append(']').toString();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("baseline", render(baseline));
        map.put("target", render(target));
        if (delta != null) map.put("delta", delta);
        map.put("reason", reason.name());
        if (!detail.isBlank()) map.put("detail", detail);
        return map;
    }

    private static String render(OutputValue value) {
        return value == null ? "<missing>" : value.render();
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        int nl = trimmed.indexOf('\n');
        return nl < 0 ? trimmed : trimmed.substring(0, nl);
    }
}
