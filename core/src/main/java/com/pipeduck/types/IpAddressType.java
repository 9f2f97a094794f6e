package com.pipeduck.types;

/**
 * IPv4 or IPv6 address, the dedicated counterpart of the index {@code ip} field type.
 */
public final class IpAddressType implements DataType {

    private static final IpAddressType INSTANCE = new IpAddressType();

    private IpAddressType() {}

    public static IpAddressType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "ip";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IpAddressType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
