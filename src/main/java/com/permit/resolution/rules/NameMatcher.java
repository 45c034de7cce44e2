package com.permit.resolution.rules;

import java.util.List;

/**
 * Compares normalized names beyond exact equality.
 */
public final class NameMatcher {

    private NameMatcher() {
    }

    /**
     * Returns true when two different keys can name the same person through initials:
     * same token count, same last token, and every other token is equal or one side is
     * the initial of the other ("j doe" and "jane doe").
     */
    public static boolean initialsCompatible(NameKey a, NameKey b) {
        if (a.isEmpty() || b.isEmpty() || a.normalized().equals(b.normalized())) {
            return false;
        }
        List<String> left = a.tokens();
        List<String> right = b.tokens();
        if (left.size() != right.size() || left.size() < 2) {
            return false;
        }
        int last = left.size() - 1;
        if (!left.get(last).equals(right.get(last))) {
            return false;
        }
        boolean usedInitial = false;
        for (int i = 0; i < last; i++) {
            String l = left.get(i);
            String r = right.get(i);
            if (l.equals(r)) {
                continue;
            }
            if (isInitialOf(l, r) || isInitialOf(r, l)) {
                usedInitial = true;
            } else {
                return false;
            }
        }
        return usedInitial;
    }

    private static boolean isInitialOf(String initial, String word) {
        return initial.length() == 1 && word.length() > 1 && word.charAt(0) == initial.charAt(0);
    }
}
