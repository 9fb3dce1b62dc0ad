package io.github.ofx2json;

/// A value of the converted document: an object, an array, a string, a number or a boolean.
///
/// Objects and arrays are filled while the container stack runs and must be
/// treated as read-only once [Ofx2Json#convert(String)] has returned them.
/// `toString()` renders compact JSON.
public sealed interface TreeValue permits TreeObject, TreeArray, TreeString, TreeNumber, TreeBoolean {
}
