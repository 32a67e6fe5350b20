/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.lognog.util;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Classifies IPv4 addresses.
 *
 * <p>Ranges are tested in the order of {@link #RANGES}; the first that
 * contains the address determines its class. An address in no range is
 * {@link IpClass#PUBLIC}.
 */
public abstract class IpClassifier {
  /** Ranges, in the order they are tested. */
  public static final ImmutableList<Range> RANGES =
      ImmutableList.of(
          new Range("127.0.0.0", "127.255.255.255", IpClass.LOOPBACK),
          new Range("169.254.0.0", "169.254.255.255", IpClass.LINK_LOCAL),
          new Range("224.0.0.0", "239.255.255.255", IpClass.MULTICAST),
          new Range("240.0.0.0", "255.255.255.255", IpClass.RESERVED),
          new Range("0.0.0.0", "0.255.255.255", IpClass.RESERVED),
          new Range("192.0.0.0", "192.0.0.255", IpClass.RESERVED),
          new Range("192.0.2.0", "192.0.2.255", IpClass.RESERVED),
          new Range("198.51.100.0", "198.51.100.255", IpClass.RESERVED),
          new Range("203.0.113.0", "203.0.113.255", IpClass.RESERVED),
          new Range("198.18.0.0", "198.19.255.255", IpClass.RESERVED),
          new Range("10.0.0.0", "10.255.255.255", IpClass.PRIVATE),
          new Range("172.16.0.0", "172.31.255.255", IpClass.PRIVATE),
          new Range("192.168.0.0", "192.168.255.255", IpClass.PRIVATE),
          new Range("100.64.0.0", "100.127.255.255", IpClass.PRIVATE));

  private IpClassifier() {}

  /** Parses a dotted-quad IPv4 address; returns -1 if the string is not
   * valid. */
  public static long parse(String s) {
    final String[] parts = s.trim().split("\\.", -1);
    if (parts.length != 4) {
      return -1;
    }
    long value = 0;
    for (String part : parts) {
      if (part.isEmpty() || part.length() > 3) {
        return -1;
      }
      int octet = 0;
      for (int i = 0; i < part.length(); i++) {
        final char c = part.charAt(i);
        if (c < '0' || c > '9') {
          return -1;
        }
        octet = octet * 10 + (c - '0');
      }
      if (octet > 255) {
        return -1;
      }
      value = (value << 8) | octet;
    }
    return value;
  }

  /** Classifies an address; returns null if it is not a valid IPv4
   * address. */
  public static @Nullable IpClass classify(String s) {
    final long address = parse(s);
    if (address < 0) {
      return null;
    }
    for (Range range : RANGES) {
      if (range.contains(address)) {
        return range.ipClass;
      }
    }
    return IpClass.PUBLIC;
  }

  /** Class of an IPv4 address. */
  public enum IpClass {
    LOOPBACK,
    LINK_LOCAL,
    MULTICAST,
    RESERVED,
    PRIVATE,
    PUBLIC;

    /** Name returned by the {@code classify_ip} function, e.g.
     * "link_local". */
    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }

    /** Whether this class is "internal", that is, not public. */
    public boolean isInternal() {
      return this != PUBLIC;
    }
  }

  /** Inclusive range of addresses. */
  public static class Range {
    public final String low;
    public final String high;
    public final IpClass ipClass;
    private final long lowValue;
    private final long highValue;

    Range(String low, String high, IpClass ipClass) {
      this.low = requireNonNull(low);
      this.high = requireNonNull(high);
      this.ipClass = requireNonNull(ipClass);
      this.lowValue = parse(low);
      this.highValue = parse(high);
    }

    public boolean contains(long address) {
      return address >= lowValue && address <= highValue;
    }

    @Override
    public String toString() {
      return low + "-" + high + ":" + ipClass.label();
    }
  }
}

// End IpClassifier.java
