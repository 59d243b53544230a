package domain.plan;

import java.util.Comparator;

/**
 * Ordering of group keys: numeric when both keys are integers (plan hash values), text otherwise.
 * {@code null} (the single, ungrouped plan) sorts first.
 */
public final class GroupKeys {

    public static final Comparator<String> ORDER = GroupKeys::compare;

    private GroupKeys() {
    }

    public static int compare(String a, String b) {
        if (a == null) return b == null ? 0 : -1;
        if (b == null) return 1;

        Long la = asLong(a);
        Long lb = asLong(b);
        if (la != null && lb != null) {
            // "7" and "007" are distinct plans
            int c = Long.compare(la, lb);
            return c != 0 ? c : a.compareTo(b);
        }
        if (la != null) return -1;
        if (lb != null) return 1;
        return a.compareTo(b);
    }

    private static Long asLong(String s) {
        String t = s.trim();
        if (t.isEmpty() || t.length() > 18) return null;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c < '0' || c > '9') {
                if (!(i == 0 && c == '-' && t.length() > 1)) return null;
            }
        }
        return Long.parseLong(t);
    }
}
