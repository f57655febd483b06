package com.xmile.codec.schema;

public record Contact(String address, String phone, String fax, String email, String website) {}
