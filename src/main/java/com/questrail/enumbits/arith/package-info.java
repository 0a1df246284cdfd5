/**
 * Enum Arithmetic
 * =============================================================================
 *
 * <p>Helpers that let enum constants substitute for primitive integers and
 * integer flag words, without exposing those operations on every enum.</p>
 *
 * <h2>Opt-in</h2>
 * <ul>
 *   <li>{@code Incrementable} – stepping via {@link com.questrail.enumbits.arith.EnumArithmetic}
 *       and {@link com.questrail.enumbits.arith.EnumVariable}</li>
 *   <li>{@code BitFlag} – bitwise combination via {@link com.questrail.enumbits.arith.FlagMask},
 *       {@link com.questrail.enumbits.arith.FlagVariable} and
 *       {@link com.questrail.enumbits.arith.Flags}</li>
 *   <li>{@code Addable} – use as an offset in
 *       {@link com.questrail.enumbits.arith.EnumArithmetic#add(Enum, Enum)}</li>
 * </ul>
 *
 * <p>Each capability is an interface bound on the operation's type parameter.
 * Calling an operation for an enum that has not opted in fails to compile.</p>
 *
 * <p>Nothing in this package is thread-safe, and nothing here checks results
 * against an enum's range.</p>
 */
package com.questrail.enumbits.arith;
