package org.javai.pegtree.tree;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import org.javai.pegtree.peg.Rule;

/**
 * Finds rules that can never contribute a node to the tree: rules that are not
 * selected and from which no selected rule is reachable. Attempts of such rules
 * need no frame at all.
 *
 * Results are computed once per rule and cached for the lifetime of the analysis.
 */
final class SelectionAnalysis {

	private final TreeSelection selection;
	private final Map<Rule, Boolean> unselectedLeaves = new IdentityHashMap<>();

	SelectionAnalysis(TreeSelection selection) {
		this.selection = selection;
	}

	boolean isUnselectedLeaf(Rule rule) {
		Boolean cached = unselectedLeaves.get(rule);
		if (cached == null) {
			cached = !reachesSelectedRule(rule);
			unselectedLeaves.put(rule, cached);
		}
		return cached;
	}

	private boolean reachesSelectedRule(Rule start) {
		Set<Rule> visited = Collections.newSetFromMap(new IdentityHashMap<>());
		Deque<Rule> pending = new ArrayDeque<>();
		pending.push(start);
		while (!pending.isEmpty()) {
			Rule rule = pending.pop();
			if (!visited.add(rule)) {
				continue;
			}
			if (selection.isSelected(rule.id())) {
				return true;
			}
			Boolean known = unselectedLeaves.get(rule);
			if (Boolean.TRUE.equals(known)) {
				continue;
			}
			for (Rule sub : rule.subRules()) {
				pending.push(sub);
			}
		}
		return false;
	}
}
