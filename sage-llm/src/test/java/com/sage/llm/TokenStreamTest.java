package com.sage.llm;

import com.sage.model.StreamEvent;
import com.sage.model.error.ModelException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TokenStreamTest {

    @Test
    void eventsAfterTerminalAreDropped() throws Exception {
        TokenStream stream = new TokenStream();
        stream.modelInfo("fast");
        stream.token("a");
        stream.done();
        stream.token("late");
        stream.error("late error");

        assertEquals(StreamEvent.Type.MODEL_INFO, stream.next().getType());
        assertEquals("a", stream.next().getToken());
        assertEquals(StreamEvent.Type.DONE, stream.next().getType());
        assertNull(stream.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    void cancelTerminatesWithDone() throws Exception {
        TokenStream stream = new TokenStream();
        stream.token("x");
        stream.cancel();
        stream.token("y");
        assertTrue(stream.isCancelled());
        assertEquals("x", stream.collect());
    }

    @Test
    void cancelRacingTheProducer_leavesDoneLast() throws Exception {
        for (int round = 0; round < 50; round++) {
            TokenStream stream = new TokenStream();
            CountDownLatch started = new CountDownLatch(1);
            Thread producer = new Thread(() -> {
                started.countDown();
                for (int i = 0; i < 10_000; i++) stream.token("t" + i);
            });
            producer.start();
            started.await();
            stream.cancel();
            producer.join(5_000L);

            List<StreamEvent> events = new ArrayList<>();
            StreamEvent event;
            while ((event = stream.poll(0, TimeUnit.MILLISECONDS)) != null) events.add(event);

            assertEquals(StreamEvent.Type.DONE, events.get(events.size() - 1).getType(), "round " + round);
            assertEquals(1, events.stream().filter(e -> e.getType() != StreamEvent.Type.TOKEN).count());
        }
    }

    @Test
    void collectRaisesOnError() {
        TokenStream stream = new TokenStream();
        stream.token("partial");
        stream.error("backend died");
        ModelException e = assertThrows(ModelException.class, stream::collect);
        assertTrue(e.getMessage().contains("backend died"));
    }
}
