package com.quickbite.menuservice.model;

/**
 * Closed menu enumeration with a public wire token.
 * The integer code of a value is its declaration ordinal.
 */
public interface CodedEnum {

    String getToken();

    String name();

    /** Integer code accepted on input. */
    int ordinal();
}
