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

/**
 * Base class for views which only support a few operations; everything else throws.
 */
public class JsonViewImpl implements JsonView {

  @Override
  public Type getType() {
    throw new UnsupportedOperationException();
  }

  @Override
  public <E> E asInstance(Class<E> clazz) {
    return null;
  }

  @Override
  public boolean isNull() {
    return false;
  }

  @Override
  public boolean asBoolean() {
    throw new UnsupportedOperationException("Not a " + Type.BOOLEAN + ": " + getType());
  }

  @Override
  public Number asNumber() {
    throw new UnsupportedOperationException("Not a " + Type.NUMBER + ": " + getType());
  }

  @Override
  public String asString() {
    throw new UnsupportedOperationException("Not a " + Type.STRING + ": " + getType());
  }

  @Override
  public int length() {
    throw new UnsupportedOperationException(getType() + " has no length");
  }

  @Override
  public boolean asArrayIsEmpty() {
    throw new UnsupportedOperationException("Not an " + Type.ARRAY + ": " + getType());
  }

  @Override
  public void asArrayForeach(ArrayVisitor visitor) {
    throw new UnsupportedOperationException("Not an " + Type.ARRAY + ": " + getType());
  }

  @Override
  public boolean asObjectIsEmpty() {
    throw new UnsupportedOperationException("Not an " + Type.OBJECT + ": " + getType());
  }

  @Override
  public void asObjectForeach(ObjectVisitor visitor) {
    throw new UnsupportedOperationException("Not an " + Type.OBJECT + ": " + getType());
  }

  @Override
  public JsonView get(String key) {
    return null;
  }

}
