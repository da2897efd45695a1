// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.stencil.json;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A JSON view over an immutable Java object.
 *
 * Maps are objects keyed by the string value of their keys; arrays, collections and other
 * iterables are arrays; anything else is an object whose keys are its public fields, its
 * public no-argument methods (as on records) and its bean getters.
 */
public class PojoJsonView implements JsonView {

  private final Object pojo;

  // Lazily-determined type.
  private Type type = null;

  // Lazily-created cache of found values via get().
  // TODO: limit the size of this cache.
  private Map<String, JsonView> foundViaGet = null;

  // Lazily-determined keys of a plain object.
  private Set<String> memberNames = null;

  public PojoJsonView(Object pojo) {
    this.pojo = pojo;
  }

  @Override
  public Type getType() {
    if (type == null) {
      if (pojo == null) {
        type = Type.NULL;
      } else if (pojo instanceof Boolean) {
        type = Type.BOOLEAN;
      } else if (pojo instanceof Number) {
        type = Type.NUMBER;
      } else if (pojo instanceof Enum ||
                 pojo instanceof CharSequence ||
                 pojo instanceof Character) {
        type = Type.STRING;
      } else if (pojo.getClass().isArray() || pojo instanceof Iterable) {
        type = Type.ARRAY;
      } else {
        type = Type.OBJECT;
      }
    }
    return type;
  }

  @Override
  public <E> E asInstance(Class<E> clazz) {
    if (pojo != null && clazz.isAssignableFrom(pojo.getClass()))
      return clazz.cast(pojo);
    else
      return null;
  }

  @Override
  public boolean isNull() {
    return getType() == Type.NULL;
  }

  @Override
  public boolean asBoolean() {
    checkIsType(Type.BOOLEAN);
    return ((Boolean) pojo).booleanValue();
  }

  @Override
  public Number asNumber() {
    checkIsType(Type.NUMBER);
    return (Number) pojo;
  }

  @Override
  public String asString() {
    checkIsType(Type.STRING);
    if (pojo instanceof Enum)
      return ((Enum<?>) pojo).name();
    else
      return pojo.toString();
  }

  @Override
  public int length() {
    switch (getType()) {
      case STRING:
        return asString().length();
      case ARRAY:
        if (pojo.getClass().isArray())
          return Array.getLength(pojo);
        if (pojo instanceof Collection)
          return ((Collection<?>) pojo).size();
        int count = 0;
        for (Object ignored : (Iterable<?>) pojo)
          count++;
        return count;
      case OBJECT:
        if (pojo instanceof Map)
          return ((Map<?, ?>) pojo).size();
        return memberNames().size();
      default:
        throw new UnsupportedOperationException(getType() + " has no length");
    }
  }

  @Override
  public boolean asArrayIsEmpty() {
    checkIsType(Type.ARRAY);
    if (pojo instanceof Collection)
      return ((Collection<?>) pojo).isEmpty();
    if (pojo instanceof Iterable)
      return !((Iterable<?>) pojo).iterator().hasNext();
    return Array.getLength(pojo) == 0;
  }

  @Override
  public void asArrayForeach(ArrayVisitor visitor) {
    checkIsType(Type.ARRAY);
    if (pojo.getClass().isArray()) {
      for (int i = 0, length = Array.getLength(pojo); i < length; i++)
        visitor.visit(JsonViews.of(Array.get(pojo, i)), i);
    } else {
      int i = 0;
      for (Object value : (Iterable<?>) pojo)
        visitor.visit(JsonViews.of(value), i++);
    }
  }

  /**
   * Only maps can be empty; any other object counts as having members.
   */
  @Override
  public boolean asObjectIsEmpty() {
    checkIsType(Type.OBJECT);
    if (pojo instanceof Map)
      return ((Map<?, ?>) pojo).isEmpty();
    return false;
  }

  @Override
  public void asObjectForeach(ObjectVisitor visitor) {
    checkIsType(Type.OBJECT);
    if (pojo instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) pojo).entrySet())
        visitor.visit(String.valueOf(entry.getKey()), JsonViews.of(entry.getValue()));
    } else {
      for (String name : memberNames())
        visitor.visit(name, get(name));
    }
  }

  /**
   * The keys {@link #get} resolves on a plain object: public fields, then accessors by property
   * name (getName and isName as name, other methods as themselves).
   */
  private Set<String> memberNames() {
    if (memberNames == null) {
      Set<String> names = new LinkedHashSet<String>();
      Class<?> clazz = pojo.getClass();
      for (Field field : clazz.getFields()) {
        if (!Modifier.isStatic(field.getModifiers()))
          names.add(field.getName());
      }
      Set<String> accessors = new TreeSet<String>();
      for (Method method : clazz.getMethods()) {
        if (method.getParameterTypes().length == 0 &&
            findAccessor(clazz, method.getName()) != null)
          accessors.add(propertyName(method.getName()));
      }
      names.addAll(accessors);
      memberNames = names;
    }
    return memberNames;
  }

  private static String propertyName(String methodName) {
    String rest;
    if (methodName.startsWith("get") && methodName.length() > 3)
      rest = methodName.substring(3);
    else if (methodName.startsWith("is") && methodName.length() > 2)
      rest = methodName.substring(2);
    else
      return methodName;
    if (!Character.isUpperCase(rest.charAt(0)))
      return methodName;
    return Character.toLowerCase(rest.charAt(0)) + rest.substring(1);
  }

  @Override
  public JsonView get(String key) {
    Type t = getType();
    if (t != Type.OBJECT && t != Type.ARRAY)
      return null;
    if (foundViaGet == null)
      foundViaGet = new HashMap<String, JsonView>();
    JsonView result = foundViaGet.get(key);
    if (result == null) {
      result = (t == Type.OBJECT) ? doGet(key) : doGetIndex(key);
      if (result != null)
        foundViaGet.put(key, result);
    }
    return result;
  }

  private JsonView doGet(String key) {
    if (pojo instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) pojo;
      if (!map.containsKey(key))
        return null;
      return JsonViews.of(map.get(key));
    }

    Class<?> clazz = pojo.getClass();
    try {
      Field field = clazz.getField(key);
      if (!Modifier.isStatic(field.getModifiers()))
        return JsonViews.of(field.get(pojo));
    } catch (NoSuchFieldException e) {
      // Fall through to accessor methods.
    } catch (IllegalAccessException e) {
      throw new UnsupportedOperationException(e);
    }

    if (key.isEmpty())
      return null;
    String capitalized = Character.toUpperCase(key.charAt(0)) + key.substring(1);
    for (String name : new String[] {key, "get" + capitalized, "is" + capitalized}) {
      Method method = findAccessor(clazz, name);
      if (method == null)
        continue;
      try {
        return JsonViews.of(method.invoke(pojo));
      } catch (IllegalAccessException e) {
        throw new UnsupportedOperationException(e);
      } catch (InvocationTargetException e) {
        throw new UnsupportedOperationException(
            "Accessor " + clazz.getName() + "#" + name + " failed", e.getCause());
      }
    }
    return null;
  }

  private JsonView doGetIndex(String key) {
    int length = length();
    if ("length".equals(key))
      return new PojoJsonView(length);

    int index;
    try {
      index = Integer.parseInt(key);
    } catch (NumberFormatException e) {
      return null;
    }
    if (index < 0 || index >= length)
      return null;

    if (pojo.getClass().isArray())
      return JsonViews.of(Array.get(pojo, index));
    int i = 0;
    for (Object value : (Iterable<?>) pojo) {
      if (i++ == index)
        return JsonViews.of(value);
    }
    return null;
  }

  private static Method findAccessor(Class<?> clazz, String name) {
    try {
      Method method = clazz.getMethod(name);
      if (Modifier.isStatic(method.getModifiers()) ||
          method.getReturnType() == Void.TYPE ||
          method.getDeclaringClass() == Object.class)
        return null;
      return method;
    } catch (NoSuchMethodException e) {
      return null;
    }
  }

  private void checkIsType(Type t) {
    if (getType() != t)
      throw new UnsupportedOperationException("Unexpected type " + getType() + ", expected " + t);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this)
      return true;
    if (o == null || o.getClass() != getClass())
      return false;
    PojoJsonView other = (PojoJsonView) o;
    if (pojo == null)
      return other.pojo == null;
    else
      return pojo.equals(other.pojo);
  }

  @Override
  public int hashCode() {
    return pojo == null ? 0 : pojo.hashCode();
  }

  @Override
  public String toString() {
    if (getType() == Type.NUMBER)
      return JsonViews.formatNumber((Number) pojo);
    if (getType() == Type.STRING)
      return asString();
    return pojo + "";
  }

}
