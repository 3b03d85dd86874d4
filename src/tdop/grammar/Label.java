package tdop.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The role tag of a token class. A multi-role label matches each of its roles; the token
 * instance settles on one of them with {@link tdop.parser.Token#resolveRole(Role)} once the
 * parse has seen enough context.
 */
public final class Label {

	private final List<Role> roles;

	private Label(List<Role> roles) {
		this.roles = roles;
	}

	public static Label of(Role role, Role... more) {
		if(more.length == 0) {
			return new Label(Collections.singletonList(role));
		}
		Role[] all = new Role[more.length + 1];
		all[0] = role;
		System.arraycopy(more, 0, all, 1, more.length);
		return new Label(Collections.unmodifiableList(Arrays.asList(all)));
	}

	public boolean is(Role role) {
		return roles.contains(role);
	}

	public boolean isMultiRole() {
		return roles.size() > 1;
	}

	public List<Role> getRoles() {
		return roles;
	}

	/**
	 * @return the role of a single-role label, the first declared role otherwise
	 */
	public Role getPrimaryRole() {
		return roles.get(0);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return roles.equals(((Label) o).roles);
	}

	@Override
	public int hashCode() {
		return roles.hashCode();
	}

	@Override
	public String toString() {
		if(roles.size() == 1) {
			return roles.get(0).getDisplayName();
		}
		return roles.stream()
				.map(r -> r.getDisplayName().replace(' ', '_'))
				.collect(Collectors.joining("__"));
	}
}
