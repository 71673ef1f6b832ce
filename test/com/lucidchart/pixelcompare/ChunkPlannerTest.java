package com.lucidchart.pixelcompare;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.List;

public class ChunkPlannerTest {

    private static final int WIDTH = 1080;

    @Test
    public void testEvenSplit() {
        ChunkPlan plan = ChunkPlanner.plan(100, 4);
        Assert.assertEquals(plan.size(), 4);
        for (Chunk chunk : plan.getChunks())
            Assert.assertEquals(chunk.size(), 25);
    }

    @Test
    public void testRemainderGoesToTheFirstChunks() {
        ChunkPlan plan = ChunkPlanner.plan(9, 2);
        Assert.assertEquals(plan.getChunks().get(0), new Chunk(0, 5));
        Assert.assertEquals(plan.getChunks().get(1), new Chunk(5, 9));

        List<Chunk> sevenWays = ChunkPlanner.plan(2_397_600, 7).getChunks();
        // 2397600 = 7 * 342514 + 2
        Assert.assertEquals(sevenWays.get(0).size(), 342515);
        Assert.assertEquals(sevenWays.get(1).size(), 342515);
        for (int i = 2; i < 7; i++)
            Assert.assertEquals(sevenWays.get(i).size(), 342514);
    }

    @Test
    public void testMoreWorkersThanPixels() {
        ChunkPlan plan = ChunkPlanner.plan(3, 16);
        Assert.assertEquals(plan.size(), 3);
        for (Chunk chunk : plan.getChunks())
            Assert.assertEquals(chunk.size(), 1);
    }

    @Test
    public void testNonPositiveWorkersAreClampedToOne() {
        Assert.assertEquals(ChunkPlanner.plan(10, 0).getChunks(), List.of(new Chunk(0, 10)));
        Assert.assertEquals(ChunkPlanner.plan(10, -3).getChunks(), List.of(new Chunk(0, 10)));
    }

    @Test (expectedExceptions = IllegalArgumentException.class)
    public void testEmptyImageIsRejected() {
        ChunkPlanner.plan(0, 2);
    }

    @Test
    public void testPlanIsDeterministic() {
        Assert.assertEquals(ChunkPlanner.plan(12_345, 7).getChunks(), ChunkPlanner.plan(12_345, 7).getChunks());
    }

    @DataProvider
    public Object[][] pixelsAndWorkers() {
        return new Object[][] {
                {1, 1}, {1, 8}, {2, 2}, {9, 2}, {9, 4}, {10, 3}, {17, 5}, {100, 7}, {101, 100}, {101, 101}, {2_397_600, 1}, {2_397_600, 13}
        };
    }

    @Test (dataProvider = "pixelsAndWorkers")
    public void testChunksCoverEveryIndexOnce(int totalPixels, int workers) {
        ChunkPlan plan = ChunkPlanner.plan(totalPixels, workers);
        Assert.assertEquals(plan.size(), Math.min(workers, totalPixels));
        Assert.assertEquals(plan.getTotalPixels(), totalPixels);

        int expectedStart = 0;
        int smallest = Integer.MAX_VALUE;
        int largest = 0;
        for (Chunk chunk : plan.getChunks()) {
            Assert.assertEquals(chunk.start, expectedStart, "Chunks must be contiguous");
            Assert.assertTrue(chunk.size() > 0);
            smallest = Math.min(smallest, chunk.size());
            largest = Math.max(largest, chunk.size());
            expectedStart = chunk.end;
        }
        Assert.assertEquals(expectedStart, totalPixels);
        Assert.assertTrue(largest - smallest <= 1, "Chunks must be balanced");
    }

    @Test
    public void testPositionOf() {
        Assert.assertEquals(ChunkPlanner.positionOf(7, WIDTH), Position.apply(7, 0));
        Assert.assertEquals(ChunkPlanner.positionOf(500, WIDTH), Position.apply(500, 0));
        Assert.assertEquals(ChunkPlanner.positionOf(1500, WIDTH), Position.apply(420, 1));
        Assert.assertEquals(ChunkPlanner.positionOf(2200, WIDTH), Position.apply(40, 2));
    }

    @Test
    public void testPositionOfRowBoundaries() {
        Assert.assertEquals(ChunkPlanner.positionOf(0, 3), Position.apply(0, 0));
        Assert.assertEquals(ChunkPlanner.positionOf(2, 3), Position.apply(2, 0));
        Assert.assertEquals(ChunkPlanner.positionOf(3, 3), Position.apply(0, 1));
        Assert.assertEquals(ChunkPlanner.positionOf(8, 3), Position.apply(2, 2));
        Assert.assertEquals(ChunkPlanner.positionOf(4, 1), Position.apply(0, 4));
    }

    @Test
    public void testPositionOfIsTheInverseOfTheLinearIndex() {
        int width = 7;
        int height = 5;
        for (int y = 0; y < height; y++)
            for (int x = 0; x < width; x++)
                Assert.assertEquals(ChunkPlanner.positionOf(y * width + x, width), Position.apply(x, y));
    }

    @Test (expectedExceptions = IllegalArgumentException.class)
    public void testPositionOfNegativeIndex() {
        ChunkPlanner.positionOf(-1, WIDTH);
    }

    @Test (expectedExceptions = IllegalArgumentException.class)
    public void testPositionOfZeroWidth() {
        ChunkPlanner.positionOf(1, 0);
    }
}
