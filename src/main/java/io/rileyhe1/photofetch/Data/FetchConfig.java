package io.rileyhe1.photofetch.Data;

public class FetchConfig
{
    private final int workerCount;
    private final int queueCapacity;
    private final int maxRetries;
    private final int fetchTimeoutMS;
    private final int jitterMinMS;
    private final int jitterMaxMS;
    private final int retryDelayMS;
    private final int rateLimitDelayMS;
    private final int timeoutRetryDelayMS;
    private final String outputDirectory;
    private final String batchSuffix;
    private final String imageExtension;

    private FetchConfig(Builder builder)
    {
        this.workerCount = builder.workerCount;
        this.queueCapacity = builder.queueCapacity > 0 ? builder.queueCapacity : builder.workerCount * 2;
        this.maxRetries = builder.maxRetries;
        this.fetchTimeoutMS = builder.fetchTimeoutMS;
        this.jitterMinMS = builder.jitterMinMS;
        this.jitterMaxMS = builder.jitterMaxMS;
        this.retryDelayMS = builder.retryDelayMS;
        this.rateLimitDelayMS = builder.rateLimitDelayMS;
        this.timeoutRetryDelayMS = builder.timeoutRetryDelayMS;
        this.outputDirectory = builder.outputDirectory;
        this.batchSuffix = builder.batchSuffix;
        this.imageExtension = builder.imageExtension;
    }

    public int getWorkerCount()
    {
        return workerCount;
    }

    public int getQueueCapacity()
    {
        return queueCapacity;
    }

    public int getMaxRetries()
    {
        return maxRetries;
    }

    public int getFetchTimeoutMS()
    {
        return fetchTimeoutMS;
    }

    public int getJitterMinMS()
    {
        return jitterMinMS;
    }

    public int getJitterMaxMS()
    {
        return jitterMaxMS;
    }

    public int getRetryDelayMS()
    {
        return retryDelayMS;
    }

    public int getRateLimitDelayMS()
    {
        return rateLimitDelayMS;
    }

    public int getTimeoutRetryDelayMS()
    {
        return timeoutRetryDelayMS;
    }

    public String getOutputDirectory()
    {
        return outputDirectory;
    }

    public String getBatchSuffix()
    {
        return batchSuffix;
    }

    public String getImageExtension()
    {
        return imageExtension;
    }

    /**
     * Creates a new builder with default values
     */
    public static Builder builder()
    {
        return new Builder();
    }

    public static FetchConfig defaultConfig()
    {
        return new Builder().build();
    }

    public static class Builder
    {
        // kept small on purpose, Google Drive throttles aggressively
        private int workerCount = 3;
        private int queueCapacity = 0; // 0 = twice the worker count
        private int maxRetries = 3;
        private int fetchTimeoutMS = 90000; // 90 seconds
        private int jitterMinMS = 500;
        private int jitterMaxMS = 2000;
        private int retryDelayMS = 1000;
        private int rateLimitDelayMS = 1000;
        private int timeoutRetryDelayMS = 2000;
        private String outputDirectory = "photos";
        private String batchSuffix = "-photo-links.csv";
        private String imageExtension = ".jpg";

        public Builder workerCount(int workerCount)
        {
            if(workerCount < 1)
            {
                throw new IllegalArgumentException("Worker count must be at least 1");
            }
            this.workerCount = workerCount;
            return this;
        }

        public Builder queueCapacity(int queueCapacity)
        {
            if(queueCapacity < 0)
            {
                throw new IllegalArgumentException("Queue capacity cannot be negative");
            }
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder maxRetries(int maxRetries)
        {
            if(maxRetries < 1)
            {
                throw new IllegalArgumentException("Max retries must be at least 1");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder fetchTimeoutMS(int fetchTimeoutMS)
        {
            if(fetchTimeoutMS < 1)
            {
                throw new IllegalArgumentException("Fetch timeout must be positive");
            }
            this.fetchTimeoutMS = fetchTimeoutMS;
            return this;
        }

        public Builder jitterMS(int minMS, int maxMS)
        {
            if(minMS < 0 || maxMS < minMS)
            {
                throw new IllegalArgumentException("Jitter window must satisfy 0 <= min <= max");
            }
            this.jitterMinMS = minMS;
            this.jitterMaxMS = maxMS;
            return this;
        }

        public Builder retryDelayMS(int retryDelayMS)
        {
            if(retryDelayMS < 0)
            {
                throw new IllegalArgumentException("Retry delay cannot be negative");
            }
            this.retryDelayMS = retryDelayMS;
            return this;
        }

        public Builder rateLimitDelayMS(int rateLimitDelayMS)
        {
            if(rateLimitDelayMS < 0)
            {
                throw new IllegalArgumentException("Rate limit delay cannot be negative");
            }
            this.rateLimitDelayMS = rateLimitDelayMS;
            return this;
        }

        public Builder timeoutRetryDelayMS(int timeoutRetryDelayMS)
        {
            if(timeoutRetryDelayMS < 0)
            {
                throw new IllegalArgumentException("Timeout retry delay cannot be negative");
            }
            this.timeoutRetryDelayMS = timeoutRetryDelayMS;
            return this;
        }

        public Builder outputDirectory(String outputDirectory)
        {
            if(outputDirectory == null || outputDirectory.trim().isEmpty())
            {
                throw new IllegalArgumentException("Output directory cannot be null or empty");
            }
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder batchSuffix(String batchSuffix)
        {
            if(batchSuffix == null || batchSuffix.isEmpty())
            {
                throw new IllegalArgumentException("Batch suffix cannot be null or empty");
            }
            this.batchSuffix = batchSuffix;
            return this;
        }

        public Builder imageExtension(String imageExtension)
        {
            if(imageExtension == null || !imageExtension.startsWith("."))
            {
                throw new IllegalArgumentException("Image extension must start with a dot");
            }
            this.imageExtension = imageExtension;
            return this;
        }

        /**
         * Convenience method to set the fetch timeout in seconds
         */
        public Builder fetchTimeoutSeconds(int seconds)
        {
            long millis = seconds * 1000L;
            if(millis > Integer.MAX_VALUE)
            {
                throw new IllegalArgumentException("Fetch timeout is too large: " + seconds + " seconds");
            }
            return fetchTimeoutMS((int) millis);
        }

        /**
         * Zeroes every wait (jitter and retry delays). Meant for tests.
         */
        public Builder noDelays()
        {
            this.jitterMinMS = 0;
            this.jitterMaxMS = 0;
            this.retryDelayMS = 0;
            this.rateLimitDelayMS = 0;
            this.timeoutRetryDelayMS = 0;
            return this;
        }

        public FetchConfig build()
        {
            return new FetchConfig(this);
        }
    }
}
