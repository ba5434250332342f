package io.tessera.core.model;

import io.tessera.core.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/// An external package or module dependency needed by generated output.
///
/// Requirements are plain values: two requirements declaring the same names,
/// module, package and system package are equal and collapse into one entry of
/// the project's requirement set.
///
/// @param names imported names, sorted and deduplicated, never null (may be empty)
/// @param module module the names are imported from, may be null
/// @param packageName installable package providing the module, may be null
/// @param systemPackage operating-system package needed at runtime, may be null
public record Requirement(List<String> names, String module, String packageName, String systemPackage)
        implements Entity<Requirement, Requirement>, Renderable, Comparable<Requirement> {

    private static final Comparator<String> NULLS_FIRST =
            Comparator.nullsFirst(Comparator.naturalOrder());

    private static final Comparator<Requirement> ORDER =
            Comparator.comparing(Requirement::packageName, NULLS_FIRST)
                    .thenComparing(Requirement::module, NULLS_FIRST)
                    .thenComparing(Requirement::names, Requirement::compareNames)
                    .thenComparing(Requirement::systemPackage, NULLS_FIRST);

    public Requirement {
        if (isBlank(module) && isBlank(packageName) && isBlank(systemPackage)) {
            throw new ValidationException(
                    "Requirement needs at least one of module, package or system package");
        }
        List<String> sorted = new ArrayList<>();
        if (names != null) {
            for (String name : new TreeSet<>(names)) {
                sorted.add(ValidationException.requireText(name, "Requirement name"));
            }
        }
        names = Collections.unmodifiableList(sorted);
        module = blankToNull(module);
        packageName = blankToNull(packageName);
        systemPackage = blankToNull(systemPackage);
    }

    /// Creates a requirement importing `names` from `module`, installed via `packageName`.
    public static Requirement of(String packageName, String module, String... names) {
        return new Requirement(List.of(names), module, packageName, null);
    }

    /// Creates a requirement on an operating-system package only.
    public static Requirement systemPackage(String systemPackage) {
        return new Requirement(List.of(), null, null, systemPackage);
    }

    @Override
    public Requirement identityKey() {
        return this;
    }

    @Override
    public Requirement merge(Requirement other) {
        return equals(other) ? this : other;
    }

    /// Renders the import statement for this requirement.
    ///
    /// @return `from <module> import <names>`, `import <module>` when no names are
    ///     declared, or an empty string for a requirement without a module
    @Override
    public String render() {
        if (module == null) {
            return "";
        }
        if (names.isEmpty()) {
            return "import " + module;
        }
        return "from " + module + " import " + String.join(", ", names);
    }

    @Override
    public int compareTo(Requirement other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "Requirement(names=["
                + String.join(",", names)
                + "], package="
                + packageName
                + ", module="
                + module
                + ", sys_package="
                + systemPackage
                + ")";
    }

    /// Lexicographic order over the name lists, shorter prefix first.
    private static int compareNames(List<String> left, List<String> right) {
        int shared = Math.min(left.size(), right.size());
        for (int i = 0; i < shared; i++) {
            int cmp = left.get(i).compareTo(right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
