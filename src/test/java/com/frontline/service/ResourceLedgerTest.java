package com.frontline.service;

import com.frontline.exception.InvariantViolationException;
import com.frontline.model.Country;
import com.frontline.model.Player;
import com.frontline.repository.CountryRepository;
import com.frontline.repository.PlayerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResourceLedger.
 */
class ResourceLedgerTest {

    private PlayerRepository playerRepository;
    private CountryRepository countryRepository;
    private ResourceLedger ledger;

    @BeforeEach
    void setUp() {
        playerRepository = new PlayerRepository();
        countryRepository = new CountryRepository();
        ledger = new ResourceLedger(playerRepository, countryRepository, new EntityLockRegistry());

        playerRepository.save(Player.builder().id("p1").username("alice").resources(100).build());
        countryRepository.save(Country.builder().id("FR").name("France").resources(1000).build());
    }

    @Nested
    @DisplayName("debit()")
    class DebitTests {

        @Test
        @DisplayName("should take the amount and return the new balance")
        void shouldDebit() {
            OperationResult<Integer> result = ledger.debit("p1", 30);

            assertTrue(result.isSuccess());
            assertEquals(70, result.getValue());
            assertEquals(70, playerRepository.findById("p1").orElseThrow().getResources());
        }

        @Test
        @DisplayName("should allow debiting the exact balance")
        void shouldDebitExactBalance() {
            assertEquals(0, ledger.debit("p1", 100).getValue());
        }

        @Test
        @DisplayName("should refuse without mutation when the balance is short")
        void shouldRefuseWhenInsufficient() {
            OperationResult<Integer> result = ledger.debit("p1", 101);

            assertFalse(result.isSuccess());
            assertEquals(ErrorKind.INSUFFICIENT_RESOURCES, result.getErrorKind());
            assertEquals(101, result.getRequiredAmount());
            assertEquals(100, result.getAvailableAmount());
            assertEquals(100, playerRepository.findById("p1").orElseThrow().getResources());
        }

        @Test
        @DisplayName("should resolve country accounts")
        void shouldDebitCountry() {
            assertEquals(990, ledger.debit("FR", 10).getValue());
        }

        @Test
        @DisplayName("should report unknown accounts as NOT_FOUND")
        void unknownAccount() {
            assertEquals(ErrorKind.NOT_FOUND, ledger.debit("ghost", 1).getErrorKind());
        }

        @Test
        @DisplayName("should reject negative amounts")
        void negativeAmount() {
            assertThrows(IllegalArgumentException.class, () -> ledger.debit("p1", -5));
        }
    }

    @Nested
    @DisplayName("credit() and generate()")
    class CreditTests {

        @Test
        @DisplayName("credit should add to the balance")
        void shouldCredit() {
            assertEquals(125, ledger.credit("p1", 25).getValue());
        }

        @Test
        @DisplayName("credit should saturate instead of overflowing")
        void shouldSaturate() {
            ledger.credit("FR", Integer.MAX_VALUE);

            assertEquals(Integer.MAX_VALUE, ledger.balanceOf("FR").getValue());
        }

        @Test
        @DisplayName("generate should add floor(rate)")
        void generateFloorsRate() {
            OperationResult<Integer> generated = ledger.generate("FR", 2.9);

            assertEquals(2, generated.getValue());
            assertEquals(1002, ledger.balanceOf("FR").getValue());
        }

        @Test
        @DisplayName("generate below 1 adds nothing")
        void generateBelowOne() {
            assertEquals(0, ledger.generate("FR", 0.5).getValue());
            assertEquals(1000, ledger.balanceOf("FR").getValue());
        }
    }

    @Nested
    @DisplayName("invariant violations")
    class FrozenTests {

        @Test
        @DisplayName("a negative balance freezes the account")
        void negativeBalanceFreezes() {
            playerRepository.save(Player.builder().id("p2").username("bob").resources(-5).build());

            assertThrows(InvariantViolationException.class, () -> ledger.debit("p2", 1));
            assertTrue(ledger.isFrozen("p2"));
            assertThrows(InvariantViolationException.class, () -> ledger.credit("p2", 10));
        }

        @Test
        @DisplayName("freezing one account leaves others usable")
        void otherAccountsUnaffected() {
            playerRepository.save(Player.builder().id("p2").username("bob").resources(-5).build());
            assertThrows(InvariantViolationException.class, () -> ledger.credit("p2", 1));

            assertTrue(ledger.debit("p1", 10).isSuccess());
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("concurrent debits never overdraw and exactly the fitting ones succeed")
        void concurrentDebits() throws Exception {
            int threads = 16;
            int attemptsPerThread = 25;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> futures = new ArrayList<>();

            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    int successes = 0;
                    for (int i = 0; i < attemptsPerThread; i++) {
                        if (ledger.debit("p1", 3).isSuccess()) {
                            successes++;
                        }
                    }
                    return successes;
                }));
            }
            start.countDown();

            int totalSuccesses = 0;
            for (Future<Integer> future : futures) {
                totalSuccesses += future.get(10, TimeUnit.SECONDS);
            }
            executor.shutdown();

            // 100 / 3 = 33 debits fit, leaving 1
            assertEquals(33, totalSuccesses);
            assertEquals(1, ledger.balanceOf("p1").getValue());
        }

        @Test
        @DisplayName("debits and unrelated writes to the same player do not lose updates")
        void debitsAndMovesDoNotClobber() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);

            Future<?> debits = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    ledger.debit("p1", 1);
                }
                return null;
            });
            Future<?> renames = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    int n = i;
                    playerRepository.update("p1", p -> p.setDisplayName("alice-" + n));
                }
                return null;
            });
            start.countDown();
            debits.get(10, TimeUnit.SECONDS);
            renames.get(10, TimeUnit.SECONDS);
            executor.shutdown();

            Player player = playerRepository.findById("p1").orElseThrow();
            assertEquals(50, player.getResources());
            assertEquals("alice-49", player.getDisplayName());
        }
    }
}
