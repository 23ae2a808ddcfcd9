package ll1.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A grammar production with a left and a right hand side.
 */
public class Production {

	/**
	 * Id of the production, its position in the grammar
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production (doesn't include any epsilon if the right hand side consists of more than
	 * epsilons, consists of a single epsilon if it is empty).
	 */
	public final List<Symbol> right;

	public Production(int id, NonTerminal left, List<Symbol> right) {
		this.id = id;
		this.left = left;
		List<Symbol> r = new ArrayList<>();
		for (Symbol sym : right){
			if (!(sym instanceof Epsilon)){
				r.add(sym);
			}
		}
		if (r.isEmpty()){
			r.add(new Epsilon());
		}
		this.right = Collections.unmodifiableList(r);
	}

	public String formatRightSide(){
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return left.toString() + " -> " + formatRightSide();
	}

	/**
	 * Is the right hand side only the empty word?
	 */
	public boolean isEpsilonProduction(){
		return right.get(0) instanceof Epsilon;
	}

	/**
	 * Does the right hand side start with the left hand side?
	 */
	public boolean isDirectlyLeftRecursive(){
		return right.get(0).equals(left);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).id == id && ((Production)obj).left.equals(left)
				&& ((Production)obj).right.equals(right);
	}

	@Override
	public int hashCode() {
		return id * 31 + left.hashCode();
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return isEpsilonProduction() ? 0 : this.right.size();
	}
}
