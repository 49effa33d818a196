package com.novalang.bridge.support;

import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 测试用原生类
 */
public final class Fixtures {

    private Fixtures() {}

    public enum Color { RED, GREEN, BLUE }

    public static class Point {
        public double x;
        public double y;

        public Point() {
        }

        public Point(double x, double y) {
            this.x = x;
            this.y = y;
        }

        public double distanceFromOrigin() {
            return Math.sqrt(x * x + y * y);
        }
    }

    public static class Address {
        public String street;
        public int zip;

        public Address() {
        }

        public Address(String street, int zip) {
            this.street = street;
            this.zip = zip;
        }
    }

    public static class Person {
        public String name;
        public Address address;
        public List<String> tags = new ArrayList<>();
        public Optional<Address> previous = Optional.empty();
        public AtomicReference<String> nickname = new AtomicReference<>();
        public Color favorite = Color.RED;
    }

    public static class Node {
        public int value;
        public Node next;
    }

    public static class Printer {
        public String last;

        public void print(int value) {
            last = "int:" + value;
        }

        public void print(double value) {
            last = "double:" + value;
        }

        public String format(String pattern, String arg) {
            return pattern.replace("{}", arg);
        }
    }

    public static class Rectangle {
        public final double width;
        public final double height;

        public Rectangle(double width, double height) {
            this.width = width;
            this.height = height;
        }

        public double area() {
            return width * height;
        }
    }

    public static class Labeled {
        public String label;
        public int count;

        public Labeled() {
            this.label = "default";
        }

        public Labeled(String label) {
            this.label = label;
        }

        public Labeled(int count) {
            this.count = count;
        }

        public Labeled(String label, int count) {
            this.label = label;
            this.count = count;
        }
    }

    public static class Resource implements AutoCloseable {
        public boolean closed;

        @Override
        public void close() {
            closed = true;
        }
    }

    public static class Counter {
        public int value;

        public void increment() {
            value++;
        }

        public int add(int delta) {
            value += delta;
            return value;
        }

        public void fail() {
            throw new IllegalStateException("boom");
        }

        public static Counter startingAt(int value) {
            Counter c = new Counter();
            c.value = value;
            return c;
        }

        public static int twice(int value) {
            return value * 2;
        }
    }

    public static class Containers {
        public int[] numbers;
        public String[] words;
        public List<Integer> list;
        public Set<String> set;
        public Deque<Long> deque;
        public List<List<String>> nested;
        public Optional<Integer> maybe;
    }

    public static class Ordered {
        public Deque<String> queue;
        public SortedSet<String> sorted;
    }

    public static class Exploding {
        public Exploding(int code) {
            throw new IllegalStateException("bad " + code);
        }
    }

    // ============ 无法绑定的形状 ============

    public static class HasMap {
        public Map<String, Integer> values;
    }

    public static class HasRawList {
        @SuppressWarnings("rawtypes")
        public List values;
    }

    public static class HasObject {
        public Object anything;
    }

    public static class HasWildcard {
        public List<? extends Number> numbers;
    }

    public static class NameClash {
        public int size;

        public int size() {
            return size;
        }
    }
}
