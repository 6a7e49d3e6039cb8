package starvation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Abstract identity of a synchronization object.
 *
 * A lock is either an access path rooted at a formal or a global variable, or the class
 * object of some class (static synchronized methods, {@code synchronized (C.class)}).
 * Paths are normalized on construction: leading outer-instance fields ({@code this$0})
 * are collapsed so that an inner class reaching its outer instance names the same lock
 * as the outer class itself.
 */
public final class Lock implements Comparable<Lock> {
	public enum Kind { FORMAL, GLOBAL, CLASS_OBJECT }

	public static final String CLASS_TYPE = "java.lang.Class";

	private static final Pattern OUTER_THIS = Pattern.compile("this\\$\\d+");

	private final Kind kind;
	private final String root;
	private final String rootType;
	private final List<Exp.Field> path;

	private Lock(Kind kind, String root, String rootType, List<Exp.Field> path) {
		if (kind == Kind.CLASS_OBJECT && !path.isEmpty()) {
			throw new IllegalArgumentException("Class object lock cannot have a field path: " + root + path);
		}
		this.kind = kind;
		this.root = root;
		this.rootType = rootType;
		this.path = Collections.unmodifiableList(path);
	}

	public static Lock of(Exp.Var base, List<Exp.Field> fields) {
		String rootType = base.getType();
		List<Exp.Field> path = new ArrayList<>(fields);
		while (!path.isEmpty() && OUTER_THIS.matcher(path.get(0).getName()).matches()) {
			rootType = path.remove(0).getType();
		}
		return new Lock(base.isGlobal() ? Kind.GLOBAL : Kind.FORMAL, base.getName(), rootType, path);
	}

	public static Lock of(Exp.Access access) {
		return of(access.getBase(), access.getFields());
	}

	public static Lock ofClass(String className) {
		return new Lock(Kind.CLASS_OBJECT, className, CLASS_TYPE, Collections.emptyList());
	}

	public Kind getKind() { return kind; }
	public String getRootType() { return rootType; }

	public boolean isClassObject() { return kind == Kind.CLASS_OBJECT; }

	/* Class whose methods may contend for this lock; none for class objects. */
	public Optional<String> ownerClass() {
		return isClassObject() ? Optional.empty() : Optional.of(rootType);
	}

	// stable but arbitrary key for ordering the two sides of a deadlock
	public String typeName() {
		return rootType;
	}

	public String describe() {
		return "`" + this + "`";
	}

	@Override
	public int compareTo(Lock o) {
		int c = toString().compareTo(o.toString());
		if (c != 0) return c;
		c = rootType.compareTo(o.rootType);
		if (c != 0) return c;
		c = root.compareTo(o.root);
		return (c != 0) ? c : kind.compareTo(o.kind);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Lock l)) return false;
		return kind == l.kind && root.equals(l.root) && rootType.equals(l.rootType) && path.equals(l.path);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, root, rootType, path);
	}

	@Override
	public String toString() {
		if (isClassObject()) return Procname.simpleName(root) + ".class";
		StringBuilder sb = new StringBuilder(kind == Kind.GLOBAL ? Procname.simpleName(root) : root);
		for (Exp.Field f : path) sb.append('.').append(f.getName());
		return sb.toString();
	}
}
