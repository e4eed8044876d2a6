package tech.terrareg.platform.authentication.method;

import tech.terrareg.platform.shared.Hashing;

import java.util.Collection;

final class ApiKeyMatcher {

    /**
     * Whether {@code presented} equals any non-empty configured key. Every key is
     * compared so timing does not reveal which one matched.
     */
    static boolean matchesAny(String presented, Collection<String> configured) {
        if (presented == null || presented.isEmpty()) {
            return false;
        }
        boolean matched = false;
        for (String key : configured) {
            if (key != null && !key.isEmpty() && Hashing.constantTimeEquals(presented, key)) {
                matched = true;
            }
        }
        return matched;
    }

    private ApiKeyMatcher() {
    }
}
