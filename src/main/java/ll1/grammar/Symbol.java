package ll1.grammar;

import java.util.Objects;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Two symbols are equal if they have the same name and are of the same kind.
 */
public abstract class Symbol implements Comparable<Symbol> {

	public final String name;

	protected Symbol(String name) {
		this.name = Objects.requireNonNull(name);
	}

	/**
	 * Used to order symbols of different kinds: non terminals, terminals, end marker, epsilon
	 */
	abstract int kindOrder();

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + kindOrder();
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.getClass() == this.getClass() && ((Symbol)obj).name.equals(name);
	}

	@Override
	public int compareTo(Symbol o) {
		if (kindOrder() != o.kindOrder()){
			return Integer.compare(kindOrder(), o.kindOrder());
		}
		return name.compareTo(o.name);
	}

	@Override
	public String toString() {
		return name;
	}
}
