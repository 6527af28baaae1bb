package me.golemcore.gateway.domain.support;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded, thread-safe buffer that evicts the oldest element when full.
 *
 * @param <T>
 *            element type
 */
public class RingBuffer<T> {

    private final Object lock = new Object();
    private final Deque<T> elements;
    private final int capacity;

    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public void add(T element) {
        synchronized (lock) {
            if (elements.size() >= capacity) {
                elements.removeFirst();
            }
            elements.addLast(element);
        }
    }

    public void addAll(List<T> batch) {
        synchronized (lock) {
            for (T element : batch) {
                if (elements.size() >= capacity) {
                    elements.removeFirst();
                }
                elements.addLast(element);
            }
        }
    }

    /**
     * Up to {@code limit} newest elements, oldest first.
     */
    public List<T> latest(int limit) {
        List<T> result = newest(limit);
        Collections.reverse(result);
        return result;
    }

    /**
     * Up to {@code limit} newest elements, newest first.
     */
    public List<T> newest(int limit) {
        if (limit <= 0) {
            return new ArrayList<>();
        }
        synchronized (lock) {
            int count = Math.min(limit, elements.size());
            List<T> result = new ArrayList<>(count);
            Iterator<T> newestFirst = elements.descendingIterator();
            for (int i = 0; i < count; i++) {
                result.add(newestFirst.next());
            }
            return result;
        }
    }

    public List<T> snapshot() {
        synchronized (lock) {
            return new ArrayList<>(elements);
        }
    }

    public int size() {
        synchronized (lock) {
            return elements.size();
        }
    }

    public int capacity() {
        return capacity;
    }
}
