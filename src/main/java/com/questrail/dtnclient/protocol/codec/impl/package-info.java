/**
 * MessagePack implementation of the application-agent codec.
 *
 * <p>Built on {@code msgpack-core}'s packer/unpacker and {@code Value} API.
 * Binary payloads travel as MessagePack {@code bin} values and integers keep
 * their full unsigned 64-bit range.</p>
 */
package com.questrail.dtnclient.protocol.codec.impl;
