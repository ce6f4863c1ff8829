package org.metricshub.romanloop.automaton;

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.metricshub.romanloop.frontend.AstNode;
import org.metricshub.romanloop.frontend.NodeKind;

/**
 * The productions of the language, indexed by their position.
 *
 * <pre>
 *  0  S'            -&gt; Program
 *  1  Program       -&gt; StatementList
 *  2  StatementList -&gt; Statement
 *  3  StatementList -&gt; StatementList ; Statement
 *  4  Statement     -&gt; while ( Condition ) Body done
 *  5  Condition     -&gt; Expression RelOp Expression
 *  6  Body          -&gt; Assignment
 *  7  Assignment    -&gt; Identifier := Expression
 *  8  Expression    -&gt; Identifier
 *  9  Expression    -&gt; RomanNumeral
 * 10  RelOp         -&gt; &lt;
 * 11  RelOp         -&gt; &gt;
 * 12  RelOp         -&gt; =
 * </pre>
 *
 * The builders receive the shifted terminals as {@link NodeKind#TOKEN} leaves
 * and always return fresh nodes, never a token leaf.
 * <p>
 * While parsing, each {@code StatementList ; Statement} reduction links the
 * left list and the new statement in constant time. The {@code Program}
 * reduction then flattens that chain into a single {@code StatementList}.
 */
public final class Grammar {

	public static final int START = 0;
	public static final int PROGRAM = 1;
	public static final int STATEMENT_LIST_SINGLE = 2;
	public static final int STATEMENT_LIST_APPEND = 3;
	public static final int WHILE_STATEMENT = 4;
	public static final int CONDITION = 5;
	public static final int BODY = 6;
	public static final int ASSIGNMENT = 7;
	public static final int EXPRESSION_IDENTIFIER = 8;
	public static final int EXPRESSION_ROMAN = 9;
	public static final int REL_OP_LESS = 10;
	public static final int REL_OP_GREATER = 11;
	public static final int REL_OP_EQUAL = 12;

	private static final List<Production> PRODUCTIONS = Collections
			.unmodifiableList(
					Arrays
							.asList(
									new Production(Nonterminal.START, "Program", children -> children.get(0)),
									new Production(Nonterminal.PROGRAM, "StatementList", Grammar::program),
									new Production(
											Nonterminal.STATEMENT_LIST,
											"Statement",
											children -> AstNode.of(NodeKind.STATEMENT_LIST, children.get(0))),
									new Production(
											Nonterminal.STATEMENT_LIST,
											"StatementList ; Statement",
											Grammar::appendStatement),
									new Production(
											Nonterminal.STATEMENT,
											"while ( Condition ) Body done",
											children -> AstNode.of(NodeKind.WHILE_LOOP, children.get(2), children.get(4))),
									new Production(
											Nonterminal.CONDITION,
											"Expression RelOp Expression",
											children -> AstNode
													.of(NodeKind.CONDITION, children.get(0), children.get(1), children.get(2))),
									new Production(Nonterminal.BODY, "Assignment", children -> children.get(0)),
									new Production(
											Nonterminal.ASSIGNMENT,
											"Identifier := Expression",
											children -> AstNode
													.of(
															NodeKind.ASSIGNMENT,
															AstNode.leaf(NodeKind.L_VALUE, children.get(0).getText()),
															children.get(2))),
									new Production(
											Nonterminal.EXPRESSION,
											"Identifier",
											children -> AstNode.leaf(NodeKind.IDENTIFIER, children.get(0).getText())),
									new Production(
											Nonterminal.EXPRESSION,
											"RomanNumeral",
											children -> AstNode.leaf(NodeKind.ROMAN_NUMERAL, children.get(0).getText())),
									new Production(Nonterminal.REL_OP, "<", Grammar::relationalOperator),
									new Production(Nonterminal.REL_OP, ">", Grammar::relationalOperator),
									new Production(Nonterminal.REL_OP, "=", Grammar::relationalOperator)));

	private Grammar() {}

	/**
	 * @return the unmodifiable, indexed list of productions
	 */
	public static List<Production> getProductions() {
		return PRODUCTIONS;
	}

	public static Production getProduction(int index) {
		return PRODUCTIONS.get(index);
	}

	private static AstNode appendStatement(List<AstNode> children) {
		return AstNode.of(NodeKind.STATEMENT_LIST, children.get(0), children.get(2));
	}

	/**
	 * Walks the chain of lists down its left spine, collecting the statements
	 * in source order.
	 */
	private static AstNode program(List<AstNode> children) {
		Deque<AstNode> statements = new ArrayDeque<AstNode>();
		AstNode list = children.get(0);
		while (true) {
			List<AstNode> parts = list.getChildren();
			for (int i = parts.size() - 1; i > 0; i--) {
				statements.addFirst(parts.get(i));
			}
			AstNode head = parts.get(0);
			if (head.getKind() != NodeKind.STATEMENT_LIST) {
				statements.addFirst(head);
				break;
			}
			list = head;
		}
		return AstNode.of(NodeKind.PROGRAM, AstNode.of(NodeKind.STATEMENT_LIST, new ArrayList<AstNode>(statements)));
	}

	private static AstNode relationalOperator(List<AstNode> children) {
		return AstNode.leaf(NodeKind.REL_OP, children.get(0).getText());
	}
}
