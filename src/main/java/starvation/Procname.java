package starvation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Identity of a procedure: declaring class, method name and parameter types.
 * The static flag is an attribute and takes no part in equality.
 */
public final class Procname implements Comparable<Procname> {
	public enum Language { JAVA, CLIKE }

	private final Language language;
	private final String className;
	private final String methodName;
	private final List<String> parameterTypes;
	private final boolean isStatic;

	private Procname(Language language, String className, String methodName, boolean isStatic, List<String> parameterTypes) {
		this.language = language;
		this.className = className;
		this.methodName = methodName;
		this.isStatic = isStatic;
		this.parameterTypes = Collections.unmodifiableList(parameterTypes);
	}

	public static Procname java(String className, String methodName, boolean isStatic, List<String> parameterTypes) {
		return new Procname(Language.JAVA, className, methodName, isStatic, List.copyOf(parameterTypes));
	}

	public static Procname java(String className, String methodName, String... parameterTypes) {
		return java(className, methodName, false, Arrays.asList(parameterTypes));
	}

	public static Procname javaStatic(String className, String methodName, String... parameterTypes) {
		return java(className, methodName, true, Arrays.asList(parameterTypes));
	}

	public static Procname clike(String className, String methodName, String... parameterTypes) {
		return new Procname(Language.CLIKE, className, methodName, false, List.of(parameterTypes));
	}

	public Language getLanguage() { return language; }
	public String getClassName() { return className; }
	public String getMethodName() { return methodName; }
	public List<String> getParameterTypes() { return parameterTypes; }
	public boolean isStatic() { return isStatic; }

	public boolean isJava() { return language == Language.JAVA; }
	public boolean isConstructor() { return "<init>".equals(methodName); }
	public boolean isClassInitializer() { return "<clinit>".equals(methodName); }

	// lambdas, access$NNN and other compiler helpers
	public boolean isAutogenName() { return methodName.indexOf('$') >= 0; }

	/** Fully qualified form, used for equality and ordering. */
	public String key() {
		return className + "." + methodName + "(" + String.join(",", parameterTypes) + ")";
	}

	public static String simpleName(String qualified) {
		int dot = qualified.lastIndexOf('.');
		return (dot < 0) ? qualified : qualified.substring(dot + 1);
	}

	@Override
	public int compareTo(Procname o) {
		return key().compareTo(o.key());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Procname other)) return false;
		return language == other.language && className.equals(other.className)
			&& methodName.equals(other.methodName) && parameterTypes.equals(other.parameterTypes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(language, className, methodName, parameterTypes);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(simpleName(className)).append('.').append(methodName).append('(');
		for (int i = 0; i < parameterTypes.size(); i++) {
			if (i > 0) sb.append(',');
			sb.append(simpleName(parameterTypes.get(i)));
		}
		return sb.append(')').toString();
	}
}
