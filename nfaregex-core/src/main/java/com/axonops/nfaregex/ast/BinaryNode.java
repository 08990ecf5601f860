/*
 * Copyright 2025 AxonOps
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
 * limitations under the License.
 */
package com.axonops.nfaregex.ast;

/**
 * Node with two children.
 */
public abstract class BinaryNode extends Node {

    protected final Node left;
    protected final Node right;

    protected BinaryNode(Node left, Node right) {
        this.left = left;
        this.right = right;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + left + ", " + right + ")";
    }
}
