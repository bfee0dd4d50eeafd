package com.tony.ladder.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Exclusion globale entre les opérations du classement.
 * Partagé : enregistrement live des matchs (plusieurs à la fois, le verrou ligne fait le reste).
 * Exclusif : transition de saison et rejeux, qui ne doivent voir aucun match arriver en cours de route.
 * Toujours pris AVANT d'ouvrir la transaction et relâché après le commit.
 */
@Component
public class LadderLock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public <T> T callShared(Supplier<T> work) {
        lock.readLock().lock();
        try {
            return work.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T callExclusive(Supplier<T> work) {
        lock.writeLock().lock();
        try {
            return work.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void runExclusive(Runnable work) {
        lock.writeLock().lock();
        try {
            work.run();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
