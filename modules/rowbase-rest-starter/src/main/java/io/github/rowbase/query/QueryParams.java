package io.github.rowbase.query;

/**
 * Parsed query language parameters of one request.
 */
public final class QueryParams {

    private final FilterExpr filter;
    private final OrderSpec order;
    private final LimitSpec limit;
    private final SelectSpec select;
    private final AggregateSpec aggregate;

    public QueryParams(FilterExpr filter, OrderSpec order, LimitSpec limit, SelectSpec select,
                       AggregateSpec aggregate) {
        this.filter = filter == null ? FilterExpr.empty() : filter;
        this.order = order == null ? OrderSpec.none() : order;
        this.limit = limit == null ? LimitSpec.none() : limit;
        this.select = select == null ? SelectSpec.all() : select;
        this.aggregate = aggregate == null ? AggregateSpec.none() : aggregate;
    }

    public static QueryParams none() {
        return new QueryParams(null, null, null, null, null);
    }

    public FilterExpr getFilter() {
        return filter;
    }

    public OrderSpec getOrder() {
        return order;
    }

    public LimitSpec getLimit() {
        return limit;
    }

    public SelectSpec getSelect() {
        return select;
    }

    public AggregateSpec getAggregate() {
        return aggregate;
    }
}
