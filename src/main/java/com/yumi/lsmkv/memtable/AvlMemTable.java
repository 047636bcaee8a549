package com.yumi.lsmkv.memtable;

import com.yumi.lsmkv.util.AllUtils;
import com.yumi.lsmkv.util.Entry;
import com.yumi.lsmkv.util.Payload;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * AVL 树实现的 mem table，所有操作 O(log n)。
 * 非线程安全：写入由调用方加锁，冻结之后可以并发读。
 */
public class AvlMemTable implements MemTable {
    private final int maxKeySize;
    private Node root;
    private int entriesCnt;
    private int bytes;
    private volatile boolean frozen;

    public AvlMemTable(int maxKeySize) {
        this.maxKeySize = maxKeySize;
    }

    @Override
    public void put(byte[] key, byte[] value, long sequence) {
        AllUtils.checkKey(key, this.maxKeySize);
        upsert(key, Payload.value(value), sequence);
    }

    @Override
    public void delete(byte[] key, long sequence) {
        AllUtils.checkKey(key, this.maxKeySize);
        upsert(key, Payload.tombstone(), sequence);
    }

    @Override
    public void apply(Entry entry) {
        AllUtils.checkKey(entry.getKey(), this.maxKeySize);
        upsert(entry.getKey(), entry.getPayload(), entry.getSequence());
    }

    private void upsert(byte[] key, Payload payload, long sequence) {
        if (this.frozen) {
            throw new IllegalStateException("mem table已冻结");
        }
        this.root = insert(this.root, key, payload, sequence);
    }

    private Node insert(Node node, byte[] key, Payload payload, long sequence) {
        if (node == null) {
            this.entriesCnt++;
            this.bytes += key.length + payload.length();
            return new Node(key, payload, sequence);
        }
        int cmp = AllUtils.compare(key, node.key);
        if (cmp < 0) {
            node.left = insert(node.left, key, payload, sequence);
        } else if (cmp > 0) {
            node.right = insert(node.right, key, payload, sequence);
        } else {
            //原地覆盖，树结构不变
            if (sequence >= node.sequence) {
                this.bytes += payload.length() - node.payload.length();
                node.payload = payload;
                node.sequence = sequence;
            }
            return node;
        }
        return rebalance(node);
    }

    private Node rebalance(Node node) {
        updateHeight(node);
        int balance = balanceFactor(node);
        if (balance > 1) {
            //左右型先把左子树左旋
            if (balanceFactor(node.left) < 0) {
                node.left = rotateLeft(node.left);
            }
            return rotateRight(node);
        }
        if (balance < -1) {
            //右左型先把右子树右旋
            if (balanceFactor(node.right) > 0) {
                node.right = rotateRight(node.right);
            }
            return rotateLeft(node);
        }
        return node;
    }

    private Node rotateLeft(Node z) {
        Node y = z.right;
        z.right = y.left;
        y.left = z;
        updateHeight(z);
        updateHeight(y);
        return y;
    }

    private Node rotateRight(Node z) {
        Node y = z.left;
        z.left = y.right;
        y.right = z;
        updateHeight(z);
        updateHeight(y);
        return y;
    }

    private static int height(Node node) {
        return node == null ? 0 : node.height;
    }

    private static void updateHeight(Node node) {
        node.height = 1 + Math.max(height(node.left), height(node.right));
    }

    private static int balanceFactor(Node node) {
        return height(node.left) - height(node.right);
    }

    @Override
    public Optional<Entry> get(byte[] key) {
        AllUtils.checkKey(key, this.maxKeySize);
        Node cur = this.root;
        while (cur != null) {
            int cmp = AllUtils.compare(key, cur.key);
            if (cmp == 0) {
                return Optional.of(new Entry(cur.key, cur.payload, cur.sequence));
            }
            cur = cmp < 0 ? cur.left : cur.right;
        }
        return Optional.empty();
    }

    @Override
    public int size() {
        return this.bytes;
    }

    @Override
    public int entriesCnt() {
        return this.entriesCnt;
    }

    @Override
    public void freeze() {
        this.frozen = true;
    }

    @Override
    public boolean isFrozen() {
        return this.frozen;
    }

    @Override
    public Iterator<Entry> drain() {
        freeze();
        return new InOrderIterator(this.root);
    }

    int height() {
        return height(this.root);
    }

    //校验每个节点的平衡因子以及记录的高度
    boolean isBalanced() {
        return checkBalanced(this.root) >= 0;
    }

    private static int checkBalanced(Node node) {
        if (node == null) {
            return 0;
        }
        int left = checkBalanced(node.left);
        int right = checkBalanced(node.right);
        if (left < 0 || right < 0 || Math.abs(left - right) > 1) {
            return -1;
        }
        int h = 1 + Math.max(left, right);
        return h == node.height ? h : -1;
    }

    private static final class Node {
        private final byte[] key;
        private Payload payload;
        private long sequence;
        private int height = 1;
        private Node left;
        private Node right;

        private Node(byte[] key, Payload payload, long sequence) {
            this.key = key;
            this.payload = payload;
            this.sequence = sequence;
        }
    }

    /**
     * 用显式栈做中序遍历，惰性产出
     */
    private static final class InOrderIterator implements Iterator<Entry> {
        private final Deque<Node> stack = new ArrayDeque<>();

        private InOrderIterator(Node root) {
            pushLeft(root);
        }

        private void pushLeft(Node node) {
            while (node != null) {
                this.stack.push(node);
                node = node.left;
            }
        }

        @Override
        public boolean hasNext() {
            return !this.stack.isEmpty();
        }

        @Override
        public Entry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Node node = this.stack.pop();
            pushLeft(node.right);
            return new Entry(node.key, node.payload, node.sequence);
        }
    }
}
