/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.shardline.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe cyclic iteration over a mutable set of elements. The unordered merge uses it
 * to give every partition a turn before any partition is served twice.
 *
 * @param <T> element type
 */
public class RoundRobin<T> {
    private final List<T> elements;
    private final ReentrantLock lock = new ReentrantLock(true);
    private int offset;

    public RoundRobin(List<T> elements) {
        this.elements = new ArrayList<>(elements);
    }

    /**
     * Returns the next element in cyclic order.
     *
     * @return the next element
     * @throws IllegalStateException if there are no elements
     */
    public T next() {
        lock.lock();
        try {
            if (elements.isEmpty()) {
                throw new IllegalStateException("No more elements available in the round-robin scheduler");
            }
            if (offset >= elements.size()) {
                offset %= elements.size();
            }
            T element = elements.get(offset);
            offset++;
            return element;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends an element.
     *
     * @param element the element
     * @throws IllegalStateException if the element is already present
     */
    public void add(T element) {
        lock.lock();
        try {
            if (elements.contains(element)) {
                throw new IllegalStateException("Element already exists");
            }
            elements.add(element);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces an element in place with its successors, which take its turn in the cycle.
     *
     * @param element      the element to replace
     * @param replacements the elements taking its position
     */
    public void replace(T element, List<T> replacements) {
        lock.lock();
        try {
            int index = elements.indexOf(element);
            if (index < 0) {
                throw new IllegalStateException("Element does not exist");
            }
            elements.remove(index);
            elements.addAll(index, replacements);
            if (offset > index) {
                offset += replacements.size() - 1;
            }
        } finally {
            lock.unlock();
        }
    }

    public void remove(T element) {
        lock.lock();
        try {
            int index = elements.indexOf(element);
            if (index < 0) {
                return;
            }
            elements.remove(index);
            if (offset > index) {
                offset--;
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return elements.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns a snapshot of the elements in cycle order starting from position zero.
     *
     * @return a copy of the elements
     */
    public List<T> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(elements);
        } finally {
            lock.unlock();
        }
    }
}
