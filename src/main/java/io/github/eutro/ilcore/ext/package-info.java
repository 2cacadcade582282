/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.ilcore.ext.ExtContainer}.
 *
 * <pre>{@code
 * class Person extends ExtHolder { ... }
 *
 * class PersonExts {
 *   public static final Ext<String> NAME = Ext.create(String.class, "name");
 *   public static final Ext<Integer> AGE = Ext.create(Integer.class, "age");
 * }
 *
 * Person person = new Person();
 * person.attachExt(AGE, 33);
 * person.attachExt(NAME, "Jane");
 *
 * person.getExtOrThrow(AGE); // => 33
 * person.getExtOrThrow(NAME); // => "Jane"
 * }</pre>
 * <p>
 * Every {@link io.github.eutro.ilcore.il.ILInstruction} and
 * {@link io.github.eutro.ilcore.il.ILVariable} is an ext container, so transforms
 * and debugging tools can annotate the tree without the tree knowing about them.
 * Exts are not copied by {@link io.github.eutro.ilcore.il.ILInstruction#clone()}.
 */
package io.github.eutro.ilcore.ext;
