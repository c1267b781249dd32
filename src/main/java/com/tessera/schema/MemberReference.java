package com.tessera.schema;

import com.tessera.error.UnknownMemberException;

/**
 * A parsed {@code Cube.member} reference.
 */
public final class MemberReference {
    private final String cubeName;
    private final String memberName;

    private MemberReference(String cubeName, String memberName) {
        this.cubeName = cubeName;
        this.memberName = memberName;
    }

    /**
     * Splits a qualified member reference.
     *
     * @throws UnknownMemberException if the reference is not of the form {@code Cube.member}
     */
    public static MemberReference parse(String reference) {
        if (reference == null) {
            throw new UnknownMemberException("Member reference must not be null");
        }
        int dot = reference.indexOf('.');
        if (dot <= 0 || dot == reference.length() - 1 || reference.indexOf('.', dot + 1) >= 0) {
            throw new UnknownMemberException("Member reference must have the form 'Cube.member'", reference);
        }
        return new MemberReference(reference.substring(0, dot), reference.substring(dot + 1));
    }

    public String getCubeName() {
        return cubeName;
    }

    public String getMemberName() {
        return memberName;
    }

    @Override
    public String toString() {
        return cubeName + "." + memberName;
    }
}
