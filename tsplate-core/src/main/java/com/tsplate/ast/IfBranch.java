package com.tsplate.ast;

/**
 * Continuation of an {@code @if} chain: either another condition or the final else.
 */
public sealed interface IfBranch extends Statement permits ElseIfStatement, ElseStatement {
}
