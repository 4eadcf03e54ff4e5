package com.nei10u.bazi.service;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 单枚硬币。正面（花）记 3，反面（字）记 2。
 */
@FunctionalInterface
public interface CoinFlipper {

    boolean heads();

    /**
     * 每线程独立的随机源，并发起卦互不共享状态
     */
    static CoinFlipper threadLocal() {
        return () -> ThreadLocalRandom.current().nextBoolean();
    }

    /**
     * 固定种子可复现；同一个 Random 跨线程共享需调用方自行负责
     */
    static CoinFlipper of(Random random) {
        return random::nextBoolean;
    }
}
