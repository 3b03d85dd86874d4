package tdop.parser;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Walks a token tree with an explicit stack, so that deep trees can't overflow the call
 * stack. See {@link Token#iter(String...)} for the visiting order.
 */
class TokenTreeIterator<C> implements Iterator<Token<C>> {

	private static final class Frame<C> {
		final Token<C> parent;
		final Iterator<Token<C>> children;

		Frame(Token<C> parent, Iterator<Token<C>> children) {
			this.parent = parent;
			this.children = children;
		}
	}

	private final Set<String> symbols;
	private final Deque<Frame<C>> stack = new ArrayDeque<>();
	private final Deque<Token<C>> ready = new ArrayDeque<>();

	// parent is set to null once it has been emitted
	private Token<C> parent;
	private Iterator<Token<C>> children;
	private boolean done;

	TokenTreeIterator(Token<C> root, String... symbols) {
		this.symbols = symbols.length == 0
				? Collections.emptySet()
				: new HashSet<>(Arrays.asList(symbols));
		this.parent = root;
		this.children = root.getChildren().iterator();
	}

	@Override
	public boolean hasNext() {
		while(ready.isEmpty() && !done) {
			step();
		}
		return !ready.isEmpty();
	}

	@Override
	public Token<C> next() {
		if(!hasNext()) {
			throw new NoSuchElementException();
		}
		return ready.poll();
	}

	private void step() {
		if(children.hasNext()) {
			Token<C> child = children.next();
			if(parent != null && parent.arity() == 1) {
				emitParent();
			}
			if(child.arity() == 0) {
				emit(child);
				if(parent != null) {
					emitParent();
				}
				return;
			}
			stack.push(new Frame<>(parent, children));
			parent = child;
			children = child.getChildren().iterator();
			return;
		}
		if(stack.isEmpty()) {
			if(parent != null) {
				emitParent();
			}
			done = true;
			return;
		}
		Frame<C> frame = stack.pop();
		parent = frame.parent;
		children = frame.children;
		if(parent != null) {
			emitParent();
		}
	}

	private void emitParent() {
		emit(parent);
		parent = null;
	}

	private void emit(Token<C> token) {
		if(symbols.isEmpty() || symbols.contains(token.getSymbol())) {
			ready.add(token);
		}
	}
}
