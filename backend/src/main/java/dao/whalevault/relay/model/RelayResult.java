package dao.whalevault.relay.model;

/**
 * @param feePaid    lamports kept by the relayer (tracked off-chain)
 * @param amountSent lamports moved by the withdrawal instruction
 */
public record RelayResult(String signature, long feePaid, long amountSent, String recipient) {}
