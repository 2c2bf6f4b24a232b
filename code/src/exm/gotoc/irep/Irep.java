/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.gotoc.irep;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.gson.stream.JsonWriter;

/**
 * Generic tree node of the CBMC goto program exchange format: an id,
 * positional children and named children.
 *
 * Named children are kept sorted by key so that output is deterministic.
 */
public class Irep {
  public static final String NIL = "nil";

  private final String id;
  private final List<Irep> sub;
  private final SortedMap<String, Irep> namedSub;

  private Irep(String id, List<Irep> sub, SortedMap<String, Irep> namedSub) {
    assert(id != null);
    this.id = id;
    this.sub = sub;
    this.namedSub = namedSub;
  }

  public static Irep create(String id, List<Irep> sub) {
    return new Irep(id, ImmutableList.copyOf(sub),
                    new TreeMap<String, Irep>());
  }

  public static Irep create(String id, Irep ...sub) {
    return create(id, ImmutableList.copyOf(sub));
  }

  public static Irep justId(String id) {
    return new Irep(id, Collections.<Irep>emptyList(),
                    new TreeMap<String, Irep>());
  }

  public static Irep nil() {
    return justId(NIL);
  }

  public static Irep one() {
    return justId("1");
  }

  public static Irep zero() {
    return justId("0");
  }

  public static Irep justInt(long i) {
    return justId(Long.toString(i));
  }

  public static Irep justInt(BigInteger i) {
    return justId(i.toString());
  }

  /**
   * Constant value in CBMC's representation: the two's complement bit
   * pattern of the given width, in upper case hex
   */
  public static Irep justBitPattern(BigInteger value, long width) {
    BigInteger mask = BigInteger.ONE.shiftLeft((int)width)
                                    .subtract(BigInteger.ONE);
    return justId(value.and(mask).toString(16).toUpperCase());
  }

  /**
   * Irep with empty id, used for records such as source locations
   */
  public static Irep record() {
    return justId("");
  }

  public String id() {
    return id;
  }

  public List<Irep> sub() {
    return sub;
  }

  public SortedMap<String, Irep> namedSub() {
    return Collections.unmodifiableSortedMap(namedSub);
  }

  public boolean isNil() {
    return id.equals(NIL) && sub.isEmpty() && namedSub.isEmpty();
  }

  /**
   * @return named child, or null if absent
   */
  public Irep lookup(String key) {
    return namedSub.get(key);
  }

  /**
   * Add a named child.  Nil values are dropped.
   * @return new irep
   */
  public Irep with(String key, Irep value) {
    if (value == null || value.isNil()) {
      return this;
    }
    SortedMap<String, Irep> newNamedSub = new TreeMap<String, Irep>(namedSub);
    newNamedSub.put(key, value);
    return new Irep(id, sub, newNamedSub);
  }

  public Irep with(String key, String stringId) {
    if (stringId == null) {
      return this;
    }
    return with(key, justId(stringId));
  }

  public void write(JsonWriter out) throws IOException {
    out.beginObject();
    out.name("id").value(id);
    if (!sub.isEmpty()) {
      out.name("sub");
      out.beginArray();
      for (Irep s: sub) {
        s.write(out);
      }
      out.endArray();
    }
    if (!namedSub.isEmpty()) {
      out.name("namedSub");
      out.beginObject();
      for (Map.Entry<String, Irep> e: namedSub.entrySet()) {
        out.name(e.getKey());
        e.getValue().write(out);
      }
      out.endObject();
    }
    out.endObject();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Irep))
      return false;
    Irep other = (Irep)obj;
    return id.equals(other.id) && sub.equals(other.sub) &&
           namedSub.equals(other.namedSub);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * id.hashCode() + sub.hashCode()) + namedSub.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(id);
    if (!sub.isEmpty()) {
      sb.append(sub);
    }
    if (!namedSub.isEmpty()) {
      sb.append(namedSub);
    }
    return sb.toString();
  }
}
