package com.di.bidshub.upload.remote;

/**
 * What the remote store reports after a transfer is durable.
 *
 * @param committedSize size of the stored object in bytes
 * @param checksum      base64 big-endian CRC32C of the stored object
 * @param revision      store-assigned revision of the object
 */
public record TransferReceipt(long committedSize, String checksum, String revision) {
}
