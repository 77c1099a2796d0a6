package net.stategraph.util;

/**
 * An object identified by a textual name.
 */
public interface NamedValue {

    /**
     * The name of this object; never null.
     */
    String getName();

}
