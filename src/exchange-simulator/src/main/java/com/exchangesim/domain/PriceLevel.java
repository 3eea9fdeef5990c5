package com.exchangesim.domain;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Resting orders at a single price point, in time priority.
 * Time priority is the order id: the lowest id is matched first, even when
 * an explicitly numbered order was added after a higher-numbered one.
 */
public class PriceLevel {

    static final Comparator<Order> TIME_PRIORITY = Comparator.comparingLong(Order::getOrderId);

    private final PriorityQueue<Order> orders = new PriorityQueue<>(TIME_PRIORITY);

    public void addOrder(Order order) {
        orders.add(order);
    }

    public Order peekFirst() {
        return orders.peek();
    }

    public Order pollFirst() {
        return orders.poll();
    }

    public boolean isEmpty() {
        return orders.isEmpty();
    }

    public int getOrderCount() {
        return orders.size();
    }

    /**
     * Orders at this level sorted by time priority. A copy; the queue's own
     * iteration order is not sorted.
     */
    public List<Order> getOrdersInPriority() {
        List<Order> sorted = new ArrayList<>(orders);
        sorted.sort(TIME_PRIORITY);
        return sorted;
    }
}
