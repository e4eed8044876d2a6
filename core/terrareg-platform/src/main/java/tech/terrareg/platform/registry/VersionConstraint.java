package tech.terrareg.platform.registry;

import org.semver4j.Semver;
import tech.terrareg.platform.error.RegistryException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Terraform module version constraint, e.g. {@code ">= 1.2, < 2.0"} or {@code "~> 1.0"}.
 *
 * Clauses are comma separated and all must hold. Partial versions are padded
 * with zeros. A pre-release version is only a candidate when a clause names a
 * pre-release of the same major.minor.patch.
 */
public final class VersionConstraint {

    private static final Pattern CLAUSE = Pattern.compile("^\\s*(=|!=|>=|<=|>|<|~>)?\\s*v?([0-9][0-9A-Za-z.+-]*)\\s*$");

    enum Operator {
        EQ, NE, GT, GE, LT, LE, PESSIMISTIC
    }

    record Clause(Operator operator, Semver version, int precision) {

        boolean matches(Semver candidate) {
            int cmp = candidate.compareTo(version);
            return switch (operator) {
                case EQ -> cmp == 0;
                case NE -> cmp != 0;
                case GT -> cmp > 0;
                case GE -> cmp >= 0;
                case LT -> cmp < 0;
                case LE -> cmp <= 0;
                case PESSIMISTIC -> cmp >= 0 && (precision == 1 || candidate.compareTo(upperBound()) < 0);
            };
        }

        /**
         * Exclusive upper bound for {@code ~>}: the second-to-last specified part is incremented.
         * A single-part version has no upper bound.
         */
        private Semver upperBound() {
            if (precision == 2) {
                return new Semver((version.getMajor() + 1) + ".0.0");
            }
            return new Semver(version.getMajor() + "." + (version.getMinor() + 1) + ".0");
        }
    }

    private static final VersionConstraint ANY = new VersionConstraint(List.of());

    private final List<Clause> clauses;

    private VersionConstraint(List<Clause> clauses) {
        this.clauses = List.copyOf(clauses);
    }

    /**
     * @throws RegistryException INVALID_INPUT on malformed clauses
     */
    public static VersionConstraint parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return ANY;
        }
        List<Clause> clauses = new ArrayList<>();
        for (String part : expression.split(",")) {
            Matcher matcher = CLAUSE.matcher(part);
            if (!matcher.matches()) {
                throw RegistryException.invalidInput("Invalid version constraint: " + expression);
            }
            String raw = matcher.group(2);
            String core = raw.split("[-+]", 2)[0];
            int precision = core.split("\\.").length;
            if (precision > 3) {
                throw RegistryException.invalidInput("Invalid version constraint: " + expression);
            }
            Semver version = Semver.parse(pad(raw, precision));
            if (version == null) {
                throw RegistryException.invalidInput("Invalid version constraint: " + expression);
            }
            clauses.add(new Clause(operatorOf(matcher.group(1)), version, precision));
        }
        return new VersionConstraint(clauses);
    }

    public boolean isSatisfiedBy(Semver candidate) {
        if (!candidate.getPreRelease().isEmpty() && !pinsPreReleaseOf(candidate)) {
            return false;
        }
        for (Clause clause : clauses) {
            if (!clause.matches(candidate)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Highest version in {@code versions} satisfying every clause. Unparseable entries are ignored.
     */
    public Optional<String> resolve(Collection<String> versions) {
        Semver best = null;
        String bestRaw = null;
        for (String raw : versions) {
            Semver candidate = Semver.parse(raw);
            if (candidate != null && isSatisfiedBy(candidate) && (best == null || candidate.compareTo(best) > 0)) {
                best = candidate;
                bestRaw = raw;
            }
        }
        return Optional.ofNullable(bestRaw);
    }

    private boolean pinsPreReleaseOf(Semver candidate) {
        for (Clause clause : clauses) {
            Semver v = clause.version();
            if (!v.getPreRelease().isEmpty()
                && v.getMajor() == candidate.getMajor()
                && v.getMinor() == candidate.getMinor()
                && v.getPatch() == candidate.getPatch()) {
                return true;
            }
        }
        return false;
    }

    private static String pad(String raw, int precision) {
        int split = indexOfSuffix(raw);
        String core = split < 0 ? raw : raw.substring(0, split);
        String suffix = split < 0 ? "" : raw.substring(split);
        StringBuilder padded = new StringBuilder(core);
        for (int i = precision; i < 3; i++) {
            padded.append(".0");
        }
        return padded.append(suffix).toString();
    }

    private static int indexOfSuffix(String raw) {
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == '-' || c == '+') {
                return i;
            }
        }
        return -1;
    }

    private static Operator operatorOf(String symbol) {
        if (symbol == null) {
            return Operator.EQ;
        }
        return switch (symbol) {
            case "!=" -> Operator.NE;
            case ">" -> Operator.GT;
            case ">=" -> Operator.GE;
            case "<" -> Operator.LT;
            case "<=" -> Operator.LE;
            case "~>" -> Operator.PESSIMISTIC;
            default -> Operator.EQ;
        };
    }

    @Override
    public String toString() {
        return clauses.toString();
    }
}
