package starvation;

/* Receiver object of LatticeElement holds the dataflow fact at a program point.
 * x.join_op(y) -> here x, y are elements of type LatticeElement and x is the receiver object.
 * Method implementations must not modify the receiver object. A fresh object (or one of the
 * operands, when the result equals it) is returned.
 * Kildall's algorithm accesses the dataflow facts only as LatticeElement, so it works for any
 * implementation.
 */

interface LatticeElement {
	public LatticeElement join_op(LatticeElement r);
	/* represents: "this" JOIN "r"
	 * this - the existing dataflow fact
	 * r    - the incoming dataflow fact
	 * must be commutative, associative and idempotent
	 */

	public boolean equals(LatticeElement r);

	public boolean isBottom();
}
