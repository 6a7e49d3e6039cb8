package starvation;

import java.util.Objects;

/* Source position of an instruction, a declaration or a report. Ordered by file, then line. */
public final class Location implements Comparable<Location> {
	public static final Location NONE = new Location("", -1);

	private final String file;
	private final int line;

	public Location(String file, int line) {
		this.file = file;
		this.line = line;
	}

	public String getFile() { return file; }
	public int getLine() { return line; }

	@Override
	public int compareTo(Location o) {
		int c = file.compareTo(o.file);
		return (c != 0) ? c : Integer.compare(line, o.line);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Location other)) return false;
		return line == other.line && file.equals(other.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, line);
	}

	@Override
	public String toString() {
		return file + ":" + line;
	}
}
