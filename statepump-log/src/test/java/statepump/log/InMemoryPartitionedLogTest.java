/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package statepump.log;

import org.hamcrest.Matcher;
import org.jetlang.core.Disposable;
import org.jetlang.fibers.Fiber;
import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import statepump.interfaces.log.LiveLogListener;
import statepump.interfaces.log.LogRecord;
import statepump.interfaces.log.TransientTransportException;
import statepump.util.ThreadFiberSupplier;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static statepump.FutureMatchers.resultsIn;
import static statepump.FutureMatchers.resultsInException;
import static statepump.MiscMatchers.simpleMatcherForPredicate;
import static statepump.log.LogTestUtil.PARTITION;
import static statepump.log.LogTestUtil.someData;

public class InMemoryPartitionedLogTest {
  @Rule
  public JUnitRuleMockery context = new JUnitRuleMockery();

  private final RecordCaptureSink captureSink = context.mock(RecordCaptureSink.class);
  private final InMemoryPartitionedLog log = new InMemoryPartitionedLog(captureSink, () -> 1234L);
  private final RecordingListener listener = new RecordingListener();
  private Fiber fiber;

  @Before
  public void startFiber() {
    fiber = new ThreadFiberSupplier("log-test").getFiber((throwable) -> {
      throw new AssertionError(throwable);
    });
    fiber.start();
  }

  @After
  public void disposeFiber() {
    fiber.dispose();
  }

  @Test
  public void assignsContiguousSequenceNumbersStartingAtZero() throws Exception {
    assertThat(log.append(PARTITION, someData("a")), is(equalTo(0L)));
    assertThat(log.append(PARTITION, someData("b")), is(equalTo(1L)));
    assertThat(log.append("other-partition", someData("c")), is(equalTo(0L)));
    assertThat(log.getOldestAvailableSeqNum(PARTITION), resultsIn(equalTo(0L)));
  }

  @Test
  public void capturesExpiringRecordsAndThenAdvancesTheFloor() throws Exception {
    appendRecords(5);

    context.checking(new Expectations() {{
      oneOf(captureSink).capture(with(equalTo(PARTITION)), with(recordsNumbered(0, 3)));
    }});

    log.expireBefore(PARTITION, 3);

    assertThat(log.getOldestAvailableSeqNum(PARTITION), resultsIn(equalTo(3L)));
  }

  @Test
  public void leavesTheFloorUnchangedIfTheRecordsCouldNotBeCaptured() throws Exception {
    appendRecords(5);

    context.checking(new Expectations() {{
      oneOf(captureSink).capture(with(equalTo(PARTITION)), with(any(List.class)));
      will(throwException(new IOException("archive unavailable")));
    }});

    try {
      log.expireBefore(PARTITION, 3);
    } catch (IOException ignore) {
    }

    assertThat(log.getOldestAvailableSeqNum(PARTITION), resultsIn(equalTo(0L)));
  }

  @Test
  public void deliversRetainedAndNewlyAppendedRecordsInOrderFromTheRequestedPosition() throws Exception {
    appendRecords(3);

    log.subscribe(PARTITION, 1, fiber, listener).get();
    log.append(PARTITION, someData("later"));

    assertThat(listener.nextRecord().getSeqNum(), is(equalTo(1L)));
    assertThat(listener.nextRecord().getSeqNum(), is(equalTo(2L)));
    LogRecord appendedLater = listener.nextRecord();
    assertThat(appendedLater.getSeqNum(), is(equalTo(3L)));
    assertThat(appendedLater.getEnqueuedAt(), is(equalTo(1234L)));
  }

  @Test
  public void stopsDeliveringOnceTheSubscriptionIsDisposed() throws Exception {
    Disposable subscription = log.subscribe(PARTITION, 0, fiber, listener).get();
    log.append(PARTITION, someData("a"));
    assertThat(listener.nextRecord().getSeqNum(), is(equalTo(0L)));

    fiber.execute(subscription::dispose);
    log.append(PARTITION, someData("b"));

    assertThat(listener.records.poll(200, TimeUnit.MILLISECONDS), is(nullValue()));
  }

  @Test
  public void redeliversARecordToCurrentSubscribers() throws Exception {
    appendRecords(2);
    log.subscribe(PARTITION, 0, fiber, listener).get();
    listener.nextRecord();
    listener.nextRecord();

    log.redeliver(PARTITION, 1);

    assertThat(listener.nextRecord().getSeqNum(), is(equalTo(1L)));
  }

  @Test
  public void reportsADisconnectToEachSubscriber() throws Exception {
    log.subscribe(PARTITION, 0, fiber, listener).get();

    log.disconnectAll();

    assertThat(listener.disconnects.poll(5, TimeUnit.SECONDS), is(instanceOf(TransientTransportException.class)));
  }

  @Test
  public void failsRequestsWithATransientErrorWhileOffline() throws Exception {
    log.setOnline(false);

    assertThat(log.getOldestAvailableSeqNum(PARTITION), resultsInException(TransientTransportException.class));
    assertThat(log.subscribe(PARTITION, 0, fiber, listener), resultsInException(TransientTransportException.class));

    log.setOnline(true);
    assertThat(log.getOldestAvailableSeqNum(PARTITION), resultsIn(equalTo(0L)));
  }

  private void appendRecords(int howMany) {
    for (int i = 0; i < howMany; i++) {
      log.append(PARTITION, someData("record-" + i));
    }
  }

  private static Matcher<List<LogRecord>> recordsNumbered(long first, long end) {
    return simpleMatcherForPredicate((List<LogRecord> records) -> {
      if (records.size() != end - first) {
        return false;
      }
      for (int i = 0; i < records.size(); i++) {
        if (records.get(i).getSeqNum() != first + i) {
          return false;
        }
      }
      return true;
    }, (description) -> description.appendText("records [" + first + ", " + end + ")"));
  }

  private static class RecordingListener implements LiveLogListener {
    final BlockingQueue<LogRecord> records = new LinkedBlockingQueue<>();
    final BlockingQueue<Throwable> disconnects = new LinkedBlockingQueue<>();

    @Override
    public void onRecord(LogRecord record) {
      records.add(record);
    }

    @Override
    public void onDisconnect(Throwable cause) {
      disconnects.add(cause);
    }

    LogRecord nextRecord() throws InterruptedException {
      LogRecord record = records.poll(5, TimeUnit.SECONDS);
      if (record == null) {
        throw new AssertionError("No record delivered within timeout");
      }
      return record;
    }
  }
}
