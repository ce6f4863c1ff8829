package org.metricshub.romanloop.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Romanloop
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the abstract syntax tree.
 * <p>
 * A node is either a leaf carrying the spelling of an identifier, literal or
 * operator, or an internal node with children and empty text. Nodes are
 * immutable: the tree is built bottom-up by the reductions of the
 * {@link LrParser} and each reduction creates new nodes from already
 * completed children.
 */
public final class AstNode {

	private final NodeKind kind;
	private final String text;
	private final List<AstNode> children;

	private AstNode(NodeKind kind, String text, List<AstNode> children) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = text;
		this.children = children;
	}

	/**
	 * Creates a leaf.
	 *
	 * @param kind tag of the leaf
	 * @param text spelling held by the leaf
	 * @return a new leaf node
	 */
	public static AstNode leaf(NodeKind kind, String text) {
		return new AstNode(kind, text == null ? "" : text, Collections.<AstNode>emptyList());
	}

	/**
	 * Creates an internal node. The children are copied.
	 *
	 * @param kind tag of the node
	 * @param children the children, in source order
	 * @return a new internal node
	 */
	public static AstNode of(NodeKind kind, List<AstNode> children) {
		for (AstNode child : children) {
			Objects.requireNonNull(child, "child");
		}
		return new AstNode(kind, "", Collections.unmodifiableList(new ArrayList<AstNode>(children)));
	}

	/**
	 * Creates an internal node.
	 *
	 * @param kind tag of the node
	 * @param children the children, in source order
	 * @return a new internal node
	 */
	public static AstNode of(NodeKind kind, AstNode... children) {
		List<AstNode> list = new ArrayList<AstNode>(children.length);
		Collections.addAll(list, children);
		return of(kind, list);
	}

	public NodeKind getKind() {
		return kind;
	}

	/**
	 * @return the spelling of a leaf, or an empty string for internal nodes
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the unmodifiable list of children, in source order
	 */
	public List<AstNode> getChildren() {
		return children;
	}

	public AstNode getChild(int index) {
		return children.get(index);
	}

	public boolean isLeaf() {
		return children.isEmpty();
	}

	/**
	 * Dump a text representation of this tree to the print stream:
	 * one node per line, pre-order, indented two spaces per level.
	 *
	 * @param ps The print stream to dump the text representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append("  ");
		}
		ps.println(spaces + toString());
		for (AstNode child : children) {
			child.dump(ps, lvl + 1);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof AstNode)) {
			return false;
		}
		AstNode other = (AstNode) o;
		return kind == other.kind && text.equals(other.text) && children.equals(other.children);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, children);
	}

	/**
	 * @return {@code Kind} or {@code Kind (text)} when the text is not empty
	 */
	@Override
	public String toString() {
		if (text.isEmpty()) {
			return kind.getLabel();
		}
		return kind.getLabel() + " (" + text + ")";
	}
}
