package starvation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/* Expressions as they appear in call actuals: access paths, class literals and other constants. */
public abstract class Exp {

	/* Root of an access path: a formal, a local, or a global (class-level) variable. */
	public static final class Var {
		private final String name;
		private final String type;
		private final boolean global;

		public Var(String name, String type, boolean global) {
			this.name = name;
			this.type = type;
			this.global = global;
		}

		public String getName() { return name; }
		public String getType() { return type; }
		public boolean isGlobal() { return global; }

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (!(o instanceof Var v)) return false;
			return global == v.global && name.equals(v.name) && type.equals(v.type);
		}

		@Override
		public int hashCode() { return Objects.hash(name, type, global); }

		@Override
		public String toString() { return name; }
	}

	/* One field dereference step; the type is the declared type of the field. */
	public static final class Field {
		private final String name;
		private final String type;

		public Field(String name, String type) {
			this.name = name;
			this.type = type;
		}

		public String getName() { return name; }
		public String getType() { return type; }

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (!(o instanceof Field f)) return false;
			return name.equals(f.name) && type.equals(f.type);
		}

		@Override
		public int hashCode() { return Objects.hash(name, type); }

		@Override
		public String toString() { return name; }
	}

	public static final class Access extends Exp {
		private final Var base;
		private final List<Field> fields;

		Access(Var base, List<Field> fields) {
			this.base = base;
			this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
		}

		public Var getBase() { return base; }
		public List<Field> getFields() { return fields; }

		public Access withField(Field f) {
			List<Field> nu = new ArrayList<>(fields);
			nu.add(f);
			return new Access(base, nu);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (!(o instanceof Access a)) return false;
			return base.equals(a.base) && fields.equals(a.fields);
		}

		@Override
		public int hashCode() { return Objects.hash(base, fields); }

		@Override
		public String toString() {
			StringBuilder sb = new StringBuilder(base.getName());
			for (Field f : fields) sb.append('.').append(f.getName());
			return sb.toString();
		}
	}

	public static final class ClassLiteral extends Exp {
		private final String className;

		ClassLiteral(String className) { this.className = className; }

		public String getClassName() { return className; }

		@Override
		public boolean equals(Object o) {
			return this == o || (o instanceof ClassLiteral c && className.equals(c.className));
		}

		@Override
		public int hashCode() { return className.hashCode(); }

		@Override
		public String toString() { return className + ".class"; }
	}

	public static final class Constant extends Exp {
		private final String value;

		Constant(String value) { this.value = value; }

		@Override
		public boolean equals(Object o) {
			return this == o || (o instanceof Constant c && value.equals(c.value));
		}

		@Override
		public int hashCode() { return value.hashCode(); }

		@Override
		public String toString() { return value; }
	}

	public static Access access(Var base, Field... fields) {
		return new Access(base, Arrays.asList(fields));
	}

	public static ClassLiteral classLiteral(String className) {
		return new ClassLiteral(className);
	}

	public static Constant constant(String value) {
		return new Constant(value);
	}
}
