package dao.whalevault.relay.model;

public record TokenInfo(String address, String symbol, String name, int decimals, String logoUri) {}
